package com.infomedia.abacox.callshipping.component.delivery;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.apiclient.CallApiClient;
import com.infomedia.abacox.callshipping.component.apiclient.DeliveryException;
import com.infomedia.abacox.callshipping.component.apiclient.DeliveryFailureType;
import com.infomedia.abacox.callshipping.component.apiclient.SubmitResult;
import com.infomedia.abacox.callshipping.component.dedup.DedupStoreService;
import com.infomedia.abacox.callshipping.component.dedup.ShipmentLogService;
import com.infomedia.abacox.callshipping.component.dedup.StateStoreException;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.engine.FatalErrorHandler;
import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import com.infomedia.abacox.callshipping.db.entity.ShipmentLog.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.infomedia.abacox.callshipping.component.EngineFixtures.T0;
import static com.infomedia.abacox.callshipping.component.delivery.DeliveryQueueServiceTest.aggregate;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DeliveryBatchWorkerTest {

    private EngineFixtures.MutableClock clock;
    private DeliveryQueueService queue;
    private CallApiClient apiClient;
    private DedupStoreService dedupStore;
    private ShipmentLogService shipmentLog;
    private FatalErrorHandler fatalErrorHandler;
    private DeliveryBatchWorker worker;

    @BeforeEach
    void setUp() {
        clock = new EngineFixtures.MutableClock(T0);
        EngineConfigService config = EngineFixtures.config();
        queue = new DeliveryQueueService(config, EngineFixtures.metrics(), clock);
        apiClient = mock(CallApiClient.class);
        dedupStore = mock(DedupStoreService.class);
        shipmentLog = mock(ShipmentLogService.class);
        fatalErrorHandler = mock(FatalErrorHandler.class);
        when(dedupStore.recordAttempt(anyString())).thenReturn(1);
        when(dedupStore.recordRetry(anyString(), any(), anyString())).thenReturn(T0);
        worker = new DeliveryBatchWorker(queue, apiClient, dedupStore, shipmentLog, new BackoffPolicy(config),
                config, EngineFixtures.metrics(), fatalErrorHandler, clock);
    }

    private static SubmitResult failure(int status) {
        return SubmitResult.failed(new DeliveryException(DeliveryFailureType.fromStatus(status), status, "HTTP " + status));
    }

    @Test
    void testSuccessfulBatchIsDelivered() {
        queue.enqueue(aggregate("a", ShippingPhase.SHIPPED_COMPLETE, 10), "h1");
        queue.enqueue(aggregate("b", ShippingPhase.SHIPPED_COMPLETE, 20), "h2");
        when(apiClient.submit(anyList())).thenReturn(SubmitResult.success(List.of("a", "b"), Map.of(), 200));

        assertEquals(1, worker.flush(true));

        assertEquals(0, queue.size());
        verify(dedupStore).recordDelivered("a", ShippingPhase.SHIPPED_COMPLETE, false);
        verify(dedupStore).recordDelivered("b", ShippingPhase.SHIPPED_COMPLETE, false);
        verify(shipmentLog).log(eq("a"), eq(ShippingPhase.SHIPPED_COMPLETE), eq(Outcome.DELIVERED), eq(1), eq(200), eq("h1"), isNull());
    }

    @Test
    void testPartialRejectionOnlyDropsRejectedCall() {
        queue.enqueue(aggregate("a", ShippingPhase.SHIPPED_COMPLETE, 10), "h1");
        queue.enqueue(aggregate("b", ShippingPhase.SHIPPED_COMPLETE, 20), "h2");
        when(apiClient.submit(anyList())).thenReturn(SubmitResult.success(List.of("a"), Map.of("b", "invalid tenant"), 200));

        worker.flush(true);

        verify(dedupStore).recordDelivered("a", ShippingPhase.SHIPPED_COMPLETE, false);
        verify(dedupStore).recordRejected("b", "invalid tenant");
        assertEquals(0, queue.size());
    }

    @Test
    void testClientErrorIsNotRetried() {
        queue.enqueue(aggregate("a", ShippingPhase.SHIPPED_COMPLETE, 10), "h1");
        when(apiClient.submit(anyList())).thenReturn(failure(422));

        worker.flush(true);

        assertEquals(0, queue.size());
        verify(dedupStore).recordRejected("a", "HTTP 422");
        verify(dedupStore, never()).recordRetry(anyString(), any(), anyString());

        clock.advance(Duration.ofHours(1));
        worker.flush(true);
        verify(apiClient, times(1)).submit(anyList());
    }

    @Test
    void testServerErrorRetriedWithGrowingBackoff() {
        queue.enqueue(aggregate("a", ShippingPhase.SHIPPED_COMPLETE, 10), "h1");
        when(apiClient.submit(anyList())).thenReturn(failure(503));

        worker.flush(true);

        assertEquals(1, queue.size());
        verify(dedupStore).recordRetry("a", T0.plusSeconds(300), "HTTP 503");
        assertEquals(T0.plusSeconds(300), queue.earliestRetryAt());

        clock.advance(Duration.ofSeconds(299));
        assertEquals(0, worker.flush(false));

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, worker.flush(false));
        verify(dedupStore).recordRetry("a", T0.plusSeconds(300 + 600), "HTTP 503");
        verify(shipmentLog, times(2)).log(eq("a"), any(), eq(Outcome.RETRY), anyInt(), eq(503), eq("h1"), eq("HTTP 503"));
    }

    @Test
    void testGivesUpAfterRetryDeadline() {
        queue.enqueue(aggregate("a", ShippingPhase.SHIPPED_COMPLETE, 10), "h1");
        when(apiClient.submit(anyList())).thenReturn(failure(500));
        worker.flush(true);

        clock.advance(Duration.ofHours(48));
        worker.flush(true);

        assertEquals(0, queue.size());
        verify(dedupStore).recordPermanentFailure("a", "HTTP 500");
        verify(shipmentLog).log(eq("a"), eq(ShippingPhase.SHIPPED_COMPLETE), eq(Outcome.FAILED), anyInt(), eq(500), eq("h1"), eq("HTTP 500"));
    }

    @Test
    void testWaitsForFullBatchOrMaxWait() {
        queue.enqueue(aggregate("a", ShippingPhase.SHIPPED_COMPLETE, 10), "h1");
        when(apiClient.submit(anyList())).thenReturn(SubmitResult.success(List.of("a"), Map.of(), 200));

        assertEquals(0, worker.flush(false));

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, worker.flush(false));
    }

    @Test
    void testStateStoreFailureIsFatal() {
        queue.enqueue(aggregate("a", ShippingPhase.SHIPPED_COMPLETE, 10), "h1");
        StateStoreException failure = new StateStoreException("disk full", new RuntimeException());
        when(dedupStore.recordAttempt("a")).thenThrow(failure);

        assertEquals(0, worker.flush(true));

        verify(fatalErrorHandler).fatal(anyString(), same(failure));
        verifyNoInteractions(apiClient);
    }

    @Test
    void testClientExceptionSchedulesRetryInsteadOfStrandingBatch() {
        queue.enqueue(aggregate("a", ShippingPhase.SHIPPED_COMPLETE, 10), "h1");
        when(apiClient.submit(anyList()))
                .thenThrow(new IllegalArgumentException("Invalid URL"))
                .thenReturn(SubmitResult.success(List.of("a"), Map.of(), 200));

        assertEquals(1, worker.flush(true));

        assertEquals(1, queue.size());
        assertEquals(T0.plusSeconds(300), queue.earliestRetryAt());
        verify(dedupStore).recordRetry(eq("a"), eq(T0.plusSeconds(300)), contains("Invalid URL"));
        verify(fatalErrorHandler, never()).fatal(anyString(), any());

        clock.advance(Duration.ofSeconds(300));
        assertEquals(1, worker.flush(false));

        assertEquals(0, queue.size());
        verify(dedupStore).recordDelivered("a", ShippingPhase.SHIPPED_COMPLETE, false);
    }
}
