package com.infomedia.abacox.callshipping.component.easyhttp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import okhttp3.OkHttpClient;
import okhttp3.logging.HttpLoggingInterceptor;

import java.time.Duration;

/**
 * Shared OkHttp connection pool plus the Jackson mapper used for request and response bodies.
 */
public class EasyHttpClient {

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private EasyHttpClient(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
    }

    OkHttpClient getOkHttpClient() {
        return okHttpClient;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public EasyHttp url(String url) {
        return new EasyHttp(url, this);
    }

    public void shutdown() {
        okHttpClient.dispatcher().executorService().shutdown();
        okHttpClient.connectionPool().evictAll();
    }

    /**
     * @param timeout applied to connect, read and the call as a whole
     */
    public static Builder builder(Duration timeout) {
        return new Builder(timeout);
    }

    public static class Builder {
        private final Duration timeout;
        private boolean logBodies;
        private boolean snakeCase;

        private Builder(Duration timeout) {
            this.timeout = timeout;
        }

        /**
         * Log full request and response bodies. The Authorization header is always redacted.
         */
        public Builder logBodies(boolean logBodies) {
            this.logBodies = logBodies;
            return this;
        }

        public Builder snakeCase() {
            this.snakeCase = true;
            return this;
        }

        public EasyHttpClient build() {
            HttpLoggingInterceptor logging = new HttpLoggingInterceptor();
            logging.setLevel(logBodies ? HttpLoggingInterceptor.Level.BODY : HttpLoggingInterceptor.Level.NONE);
            logging.redactHeader("Authorization");

            OkHttpClient okHttp = new OkHttpClient.Builder()
                    .connectTimeout(timeout)
                    .readTimeout(timeout)
                    .writeTimeout(timeout)
                    .callTimeout(timeout)
                    .addInterceptor(logging)
                    .build();

            ObjectMapper mapper = new ObjectMapper()
                    .findAndRegisterModules()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                    .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                    .setSerializationInclusion(JsonInclude.Include.NON_NULL);
            if (snakeCase) {
                mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            }
            return new EasyHttpClient(okHttp, mapper);
        }
    }
}
