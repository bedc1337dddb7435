package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.correlation.CorrelationIndex;
import com.infomedia.abacox.callshipping.component.dedup.DedupStoreService;
import com.infomedia.abacox.callshipping.component.dedup.WatermarkService;
import com.infomedia.abacox.callshipping.component.delivery.DeliveryItem;
import com.infomedia.abacox.callshipping.component.delivery.DeliveryQueueService;
import com.infomedia.abacox.callshipping.component.feed.RawRecord;
import com.infomedia.abacox.callshipping.component.normalizer.RecordNormalizer;
import com.infomedia.abacox.callshipping.component.normalizer.RecordType;
import com.infomedia.abacox.callshipping.component.shipping.AggregateHasher;
import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import com.infomedia.abacox.callshipping.component.shipping.ShippingState;
import com.infomedia.abacox.callshipping.component.shipping.ShippingStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.infomedia.abacox.callshipping.component.EngineFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CallPipelineServiceTest {

    private static final String LINKED_ID = "1714564800.50";

    private EngineFixtures.MutableClock clock;
    private WatermarkService watermarkService;
    private DedupStoreService dedupStore;
    private CorrelationIndex correlationIndex;
    private DeliveryQueueService deliveryQueue;
    private CallPipelineService pipeline;

    @BeforeEach
    void setUp() {
        setUp(Map.of());
    }

    private void setUp(Map<ConfigKey, String> config) {
        clock = new EngineFixtures.MutableClock(T0.plusSeconds(120));
        EngineFixtures.Classifiers classifiers = new EngineFixtures.Classifiers(config, clock);
        watermarkService = mock(WatermarkService.class);
        when(watermarkService.isAfterWatermark(any())).thenReturn(true);
        dedupStore = mock(DedupStoreService.class);
        when(dedupStore.getState(anyString(), anyBoolean())).thenReturn(ShippingState.NEW);
        correlationIndex = new CorrelationIndex(classifiers.config, clock);
        deliveryQueue = new DeliveryQueueService(classifiers.config, EngineFixtures.metrics(), clock);
        pipeline = new CallPipelineService(new RecordNormalizer(EngineFixtures.metrics()), watermarkService,
                correlationIndex, classifiers.aggregateBuilder, new AggregateHasher(),
                new ShippingStateMachine(classifiers.config), dedupStore, deliveryQueue, EngineFixtures.metrics(), clock);
    }

    private static RawRecord cdrRow() {
        return cdrRow(LINKED_ID);
    }

    private static RawRecord cdrRow(String linkedId) {
        return RawRecord.builder()
                .type(RecordType.CDR)
                .feedName("cdr")
                .field("calldate", "2024-05-01 12:00:00")
                .field("uniqueid", linkedId)
                .field("linkedid", linkedId)
                .field("channel", "SIP/338-acme-00000001")
                .field("dstchannel", "SIP/sbc-ca2-00000002")
                .field("dcontext", "from-internal")
                .field("src", "338")
                .field("dst", "16475550100")
                .field("disposition", "ANSWERED")
                .field("duration", "95")
                .field("billsec", "90")
                .build();
    }

    private static RawRecord linkedIdEnd() {
        return linkedIdEnd(LINKED_ID, "9001");
    }

    private static RawRecord linkedIdEnd(String linkedId, String id) {
        return RawRecord.builder()
                .type(RecordType.CEL)
                .feedName("cel")
                .field("eventtype", "LINKEDID_END")
                .field("eventtime", "2024-05-01 12:01:35")
                .field("uniqueid", linkedId)
                .field("linkedid", linkedId)
                .field("id", id)
                .build();
    }

    @Test
    void testRecordsBeforeWatermarkAreDropped() {
        when(watermarkService.isAfterWatermark(any())).thenReturn(false);

        pipeline.process(cdrRow());

        assertEquals(0, correlationIndex.size());
        verifyNoInteractions(dedupStore);
    }

    @Test
    void testClosedCallShipsComplete() {
        pipeline.process(cdrRow());
        assertEquals(0, deliveryQueue.size());

        pipeline.process(linkedIdEnd());

        assertTrue(deliveryQueue.isQueued(LINKED_ID));
        verify(dedupStore).recordShipment(eq(LINKED_ID),
                argThat(d -> d.phase() == ShippingPhase.SHIPPED_COMPLETE && !d.corrective()), anyString());
        CorrelatedGroup group = correlationIndex.get(LINKED_ID).orElseThrow();
        assertTrue(group.isSettled());
        DeliveryItem item = deliveryQueue.drain(10).get(0);
        assertTrue(item.getAggregate().isComplete());
        assertEquals(2, item.getAggregate().getCallThreadsCount());
    }

    @Test
    void testLongOpenCallShipsHeartbeat() {
        clock.set(T0.plusSeconds(650));

        pipeline.process(cdrRow());

        verify(dedupStore).recordShipment(eq(LINKED_ID),
                argThat(d -> d.phase() == ShippingPhase.SHIPPED_UPDATE && d.heartbeatCount() == 1), anyString());
        DeliveryItem item = deliveryQueue.drain(10).get(0);
        assertTrue(item.getAggregate().isLongCall());
        assertFalse(item.getAggregate().isComplete());
    }

    @Test
    void testDuplicateRecordIsNotReevaluated() {
        pipeline.process(cdrRow());
        pipeline.process(cdrRow());

        verify(dedupStore, times(1)).getState(eq(LINKED_ID), anyBoolean());
    }

    @Test
    void testReopenedDeliveredCallIsNotReshipped() {
        when(dedupStore.getState(anyString(), anyBoolean()))
                .thenReturn(new ShippingState(ShippingPhase.SHIPPED_COMPLETE, "other", 0, false, false));

        pipeline.process(cdrRow());
        pipeline.process(linkedIdEnd());

        assertEquals(0, deliveryQueue.size());
        CorrelatedGroup group = correlationIndex.get(LINKED_ID).orElseThrow();
        assertTrue(group.isReopened());
        assertTrue(group.isSettled());
        verify(dedupStore, never()).recordShipment(anyString(), any(), anyString());
    }

    @Test
    void testReopenedUndeliveredCallIsRedelivered() {
        when(dedupStore.getState(anyString(), anyBoolean()))
                .thenReturn(new ShippingState(ShippingPhase.SHIPPED_COMPLETE, "other", 0, false, true));

        pipeline.process(cdrRow());

        verify(dedupStore).recordShipment(eq(LINKED_ID),
                argThat(d -> d.phase() == ShippingPhase.SHIPPED_COMPLETE && !d.corrective()), anyString());
        assertTrue(deliveryQueue.isQueued(LINKED_ID));
    }

    @Test
    void testFullQueueLeavesCallUnsettled() {
        setUp(Map.of(ConfigKey.QUEUE_CAPACITY, "1"));
        pipeline.process(cdrRow("1714564700.10"));
        pipeline.process(linkedIdEnd("1714564700.10", "8001"));
        assertEquals(1, deliveryQueue.size());

        pipeline.process(cdrRow());
        pipeline.process(linkedIdEnd());

        verify(dedupStore).recordShipment(eq(LINKED_ID), any(), anyString());
        assertEquals(1, deliveryQueue.size());
        assertFalse(deliveryQueue.isQueued(LINKED_ID));
        assertFalse(correlationIndex.get(LINKED_ID).orElseThrow().isSettled());
        assertEquals(1, correlationIndex.sweep().getUnsettled().size());
    }

    @Test
    void testHeartbeatDueAfterInterval() {
        pipeline.process(cdrRow());
        CorrelatedGroup group = correlationIndex.get(LINKED_ID).orElseThrow();
        assertFalse(pipeline.isHeartbeatDue(group));

        clock.advance(Duration.ofSeconds(530));

        assertTrue(pipeline.isHeartbeatDue(group));
    }

    @Test
    void testThreadsCoverEveryRecord() {
        pipeline.process(cdrRow());
        pipeline.process(linkedIdEnd());

        List<DeliveryItem> batch = deliveryQueue.drain(10);
        assertEquals(2, batch.get(0).getAggregate().getCallThreads().size());
    }
}
