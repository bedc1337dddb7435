package com.infomedia.abacox.callshipping.component.classification.tenant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.callshipping.component.normalizer.CelRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans the CEL events of the group when the CDR fields gave nothing. The {@code extra} field
 * is read as JSON with a {@code tenant} attribute or as {@code tenant=name}.
 */
@Component
@Order(4)
@Log4j2
@RequiredArgsConstructor
public class CelFieldScanTenantStrategy implements TenantStrategy {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Pattern TENANT_ASSIGNMENT = Pattern.compile("tenant=([\\w]+)");

    static final List<Function<CelRecord, String>> FIELD_ORDER = List.of(
            CelRecord::getContext,
            CelRecord::getChanName,
            CelRecord::getAppData,
            CelRecord::getPeer);

    private final TenantTokenScanner scanner;
    private final TenantValidator validator;

    @Override
    public String getName() {
        return "cel_fields";
    }

    @Override
    public boolean isCacheable() {
        return false;
    }

    @Override
    public Optional<String> resolve(TenantResolutionInput input) {
        List<CelRecord> cels = input.group().getCels();
        for (Function<CelRecord, String> field : FIELD_ORDER) {
            for (CelRecord cel : cels) {
                Optional<String> tenant = scanner.scan(field.apply(cel));
                if (tenant.isPresent()) {
                    return tenant;
                }
            }
        }
        for (CelRecord cel : cels) {
            Optional<String> tenant = fromExtra(cel.getExtra());
            if (tenant.isPresent()) {
                return tenant;
            }
        }
        return Optional.empty();
    }

    Optional<String> fromExtra(String extra) {
        if (extra == null || extra.isBlank()) {
            return Optional.empty();
        }
        String trimmed = extra.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(trimmed);
                JsonNode tenant = node.get("tenant");
                if (tenant != null && tenant.isTextual()) {
                    return Optional.ofNullable(validator.validate(tenant.asText()));
                }
            } catch (Exception e) {
                log.trace("CEL extra is not valid JSON: {}", trimmed);
            }
        }
        Matcher matcher = TENANT_ASSIGNMENT.matcher(trimmed);
        if (matcher.find()) {
            return Optional.ofNullable(validator.validate(matcher.group(1)));
        }
        return Optional.empty();
    }
}
