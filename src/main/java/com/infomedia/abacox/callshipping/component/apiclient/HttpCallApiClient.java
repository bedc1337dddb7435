package com.infomedia.abacox.callshipping.component.apiclient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;
import com.infomedia.abacox.callshipping.component.easyhttp.EasyHttp;
import com.infomedia.abacox.callshipping.component.easyhttp.EasyHttpClient;
import com.infomedia.abacox.callshipping.component.easyhttp.EasyHttpException;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Posts {@code {"calls": [...]}} to the configured API URL with a bearer token.
 * 200, 201 and 202 accept the batch, except for linked ids listed under {@code rejected} in the response body.
 */
@Component
@Log4j2
public class HttpCallApiClient implements CallApiClient {

    private static final Set<Integer> SUCCESS_CODES = Set.of(200, 201, 202);

    private final EngineConfigService engineConfig;
    private final EasyHttpClient httpClient;

    public HttpCallApiClient(EngineConfigService engineConfig) {
        this.engineConfig = engineConfig;
        this.httpClient = EasyHttpClient.builder(engineConfig.getApiTimeout())
                .logBodies(log.isTraceEnabled())
                .snakeCase()
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BatchResponse(List<RejectedCall> rejected) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RejectedCall(String linkedid, String error) {
    }

    record BatchRequest(List<CallAggregate> calls) {
    }

    @Override
    public SubmitResult submit(List<CallAggregate> batch) {
        List<String> linkedIds = batch.stream().map(CallAggregate::getLinkedId).toList();
        EasyHttp.HttpResult result;
        try {
            result = httpClient.url(engineConfig.getApiUrl())
                    .bearerToken(engineConfig.getApiKey())
                    .header("User-Agent", "abacox-call-shipping/" + engineConfig.getConnectorVersion())
                    .json(new BatchRequest(batch))
                    .post();
        } catch (EasyHttpException e) {
            log.debug("Submitting {} calls failed", batch.size(), e);
            return SubmitResult.failed(new ApiClientException(e));
        } catch (IllegalArgumentException e) {
            // malformed API URL or a header value OkHttp refuses
            log.error("Calls API request could not be built: {}", e.getMessage());
            return SubmitResult.failed(new ApiClientException(e));
        }

        if (!SUCCESS_CODES.contains(result.statusCode())) {
            return SubmitResult.failed(new ApiClientException(result.statusCode(), abbreviate(result.body())));
        }

        Map<String, String> rejected = parseRejected(result.body());
        List<String> accepted = new ArrayList<>(linkedIds.size());
        for (String linkedId : linkedIds) {
            if (!rejected.containsKey(linkedId)) {
                accepted.add(linkedId);
            }
        }
        return SubmitResult.success(accepted, rejected, result.statusCode());
    }

    private Map<String, String> parseRejected(String body) {
        Map<String, String> rejected = new LinkedHashMap<>();
        if (body == null || body.isBlank() || !body.trim().startsWith("{")) {
            return rejected;
        }
        ObjectMapper mapper = httpClient.getObjectMapper();
        try {
            BatchResponse response = mapper.readValue(body, BatchResponse.class);
            if (response.rejected() != null) {
                for (RejectedCall call : response.rejected()) {
                    if (call != null && call.linkedid() != null) {
                        rejected.put(call.linkedid(), call.error() == null ? "rejected" : call.error());
                    }
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparseable API response body: {}", abbreviate(body));
        }
        return rejected;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    @PreDestroy
    public void shutdown() {
        httpClient.shutdown();
    }
}
