package com.infomedia.abacox.callshipping.component.apiclient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;
import com.infomedia.abacox.callshipping.component.aggregation.ThreadEntry;
import com.infomedia.abacox.callshipping.component.classification.CallDirection;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpCallApiClientTest {

    private MockWebServer server;
    private HttpCallApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new HttpCallApiClient(EngineFixtures.config(Map.of(
                ConfigKey.API_URL, server.url("/v1/calls").toString(),
                ConfigKey.API_KEY, "test-key",
                ConfigKey.API_TIMEOUT_SECONDS, "5")));
    }

    @AfterEach
    void tearDown() throws IOException {
        client.shutdown();
        server.shutdown();
    }

    private static CallAggregate call(String linkedId) {
        return CallAggregate.builder()
                .linkedId(linkedId)
                .direction(CallDirection.INBOUND)
                .srcNumber("16475550100")
                .dstExtension("338")
                .shippingPhase(ShippingPhase.SHIPPED_COMPLETE)
                .callThreads(List.of(ThreadEntry.builder().event("CDR").build()))
                .build();
    }

    @Test
    void testBatchPostedWithBearerToken() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202).setBody("{\"status\":\"queued\"}"));

        SubmitResult result = client.submit(List.of(call("1714564800.1"), call("1714564800.2")));

        assertNull(result.failure());
        assertEquals(List.of("1714564800.1", "1714564800.2"), result.accepted());
        assertEquals(202, result.statusCode());

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v1/calls", request.getPath());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertEquals(2, body.get("calls").size());
        JsonNode first = body.get("calls").get(0);
        assertEquals("1714564800.1", first.get("linkedid").asText());
        assertEquals("complete", first.get("shipping_phase").asText());
        assertEquals(1, first.get("call_threads_count").asInt());
    }

    @Test
    void testRejectedCallsInResponseBody() {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"rejected\":[{\"linkedid\":\"1714564800.2\",\"error\":\"unknown tenant\"}]}"));

        SubmitResult result = client.submit(List.of(call("1714564800.1"), call("1714564800.2")));

        assertEquals(List.of("1714564800.1"), result.accepted());
        assertEquals(Map.of("1714564800.2", "unknown tenant"), result.rejected());
    }

    @Test
    void testClientErrorIsRejection() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad payload\"}"));

        SubmitResult result = client.submit(List.of(call("1714564800.1")));

        assertTrue(result.isRejected());
        assertFalse(result.isRetryable());
        assertEquals(400, result.statusCode());
    }

    @Test
    void testServerErrorIsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(503));

        SubmitResult result = client.submit(List.of(call("1714564800.1")));

        assertTrue(result.isRetryable());
        assertEquals(503, result.statusCode());
    }

    @Test
    void testConnectionFailureIsRetryable() {
        // OkHttp retries a failed connection once on its own
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        SubmitResult result = client.submit(List.of(call("1714564800.1")));

        assertTrue(result.isRetryable());
        assertEquals(-1, result.statusCode());
    }

    @Test
    void testMalformedApiUrlIsRetryableFailure() {
        HttpCallApiClient misconfigured = new HttpCallApiClient(EngineFixtures.config(Map.of(
                ConfigKey.API_URL, "api.example.com/calls",
                ConfigKey.API_KEY, "test-key")));
        try {
            SubmitResult result = misconfigured.submit(List.of(call("1714564800.1")));

            assertTrue(result.isRetryable());
            assertEquals(-1, result.statusCode());
            assertTrue(result.failure().getMessage().contains("api.example.com/calls"));
        } finally {
            misconfigured.shutdown();
        }
    }

    @Test
    void testIllegalHeaderValueIsRetryableFailure() {
        HttpCallApiClient misconfigured = new HttpCallApiClient(EngineFixtures.config(Map.of(
                ConfigKey.API_URL, server.url("/v1/calls").toString(),
                ConfigKey.API_KEY, "test-key\n")));
        try {
            SubmitResult result = misconfigured.submit(List.of(call("1714564800.1")));

            assertTrue(result.isRetryable());
            assertEquals(0, server.getRequestCount());
        } finally {
            misconfigured.shutdown();
        }
    }
}
