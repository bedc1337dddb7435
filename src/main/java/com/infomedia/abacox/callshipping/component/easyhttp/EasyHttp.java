package com.infomedia.abacox.callshipping.component.easyhttp;

import com.fasterxml.jackson.core.JsonProcessingException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * One JSON request against a single URL. Created by {@link EasyHttpClient#url(String)}.
 */
public class EasyHttp {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final EasyHttpClient client;
    private final HttpUrl url;
    private final Request.Builder request = new Request.Builder();
    private RequestBody body;

    EasyHttp(String url, EasyHttpClient client) {
        HttpUrl parsed = url == null ? null : HttpUrl.parse(url.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        this.url = parsed;
        this.client = client;
    }

    public EasyHttp header(String name, String value) {
        request.header(name, value == null ? "" : value);
        return this;
    }

    public EasyHttp bearerToken(String token) {
        return header("Authorization", "Bearer " + (token == null ? "" : token));
    }

    /**
     * Serializes {@code payload} with the client's mapper as the request body.
     */
    public EasyHttp json(Object payload) {
        try {
            body = RequestBody.create(client.getObjectMapper().writeValueAsBytes(payload), JSON);
        } catch (JsonProcessingException e) {
            throw new EasyHttpException("Could not serialize request body for " + url, e);
        }
        return this;
    }

    /**
     * Sends the request as a POST. Any HTTP status comes back as a result, only transport
     * failures (refused connection, timeout, broken stream) throw.
     */
    public HttpResult post() {
        Request built = request.url(url).post(body == null ? RequestBody.create(new byte[0], JSON) : body).build();
        try (Response response = client.getOkHttpClient().newCall(built).execute()) {
            ResponseBody responseBody = response.body();
            return new HttpResult(response.code(), responseBody == null ? "" : responseBody.string());
        } catch (IOException e) {
            throw new EasyHttpException("POST " + url.redact() + " failed", e);
        }
    }

    public record HttpResult(int statusCode, String body) {
    }
}
