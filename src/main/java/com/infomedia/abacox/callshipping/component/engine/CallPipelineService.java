package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;
import com.infomedia.abacox.callshipping.component.aggregation.CallAggregateBuilder;
import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.correlation.CorrelationIndex;
import com.infomedia.abacox.callshipping.component.correlation.GroupHandle;
import com.infomedia.abacox.callshipping.component.dedup.DedupStoreService;
import com.infomedia.abacox.callshipping.component.dedup.StateStoreException;
import com.infomedia.abacox.callshipping.component.dedup.WatermarkService;
import com.infomedia.abacox.callshipping.component.delivery.DeliveryQueueService;
import com.infomedia.abacox.callshipping.component.feed.RawRecord;
import com.infomedia.abacox.callshipping.component.metrics.EngineMetrics;
import com.infomedia.abacox.callshipping.component.normalizer.NormalizationResult;
import com.infomedia.abacox.callshipping.component.normalizer.NormalizedRecord;
import com.infomedia.abacox.callshipping.component.normalizer.RecordNormalizer;
import com.infomedia.abacox.callshipping.component.shipping.AggregateHasher;
import com.infomedia.abacox.callshipping.component.shipping.ShippingDecision;
import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import com.infomedia.abacox.callshipping.component.shipping.ShippingState;
import com.infomedia.abacox.callshipping.component.shipping.ShippingStateMachine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Runs one raw record through normalization, the watermark filter and correlation, then evaluates
 * the call it belongs to: rebuild the aggregate, decide the shipment and hand it to delivery.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class CallPipelineService {

    private final RecordNormalizer normalizer;
    private final WatermarkService watermarkService;
    private final CorrelationIndex correlationIndex;
    private final CallAggregateBuilder aggregateBuilder;
    private final AggregateHasher aggregateHasher;
    private final ShippingStateMachine stateMachine;
    private final DedupStoreService dedupStore;
    private final DeliveryQueueService deliveryQueue;
    private final EngineMetrics metrics;
    private final Clock clock;

    @PostConstruct
    public void registerGauges() {
        metrics.registerGauge("callshipping.correlation.open_groups", "Calls not yet closed", correlationIndex::openGroupCount);
    }

    public void process(RawRecord raw) {
        NormalizationResult result = normalizer.normalize(raw);
        if (result.isDiscarded()) {
            return;
        }
        NormalizedRecord record = result.getRecord();
        String type = record.getType().name().toLowerCase(Locale.ROOT);
        if (!watermarkService.isAfterWatermark(record.getEventTime())) {
            metrics.recordFiltered(type, "watermark");
            log.trace("Record of call {} at {} is not after the watermark", record.getLinkedId(), record.getEventTime());
            return;
        }
        CallContext.setLinkedId(record.getLinkedId());
        try {
            GroupHandle handle = correlationIndex.ingest(record);
            metrics.recordProcessed(type);
            if (!handle.isAdded()) {
                log.trace("Duplicate {} record ignored", type);
                return;
            }
            evaluate(handle.getGroup());
        } catch (StateStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to process {} record of call {}", type, record.getLinkedId(), e);
        } finally {
            CallContext.clear();
        }
    }

    /**
     * Evaluates a call outside record processing (closure by the sweep, heartbeats, pending redelivery).
     * Errors other than state store failures are logged.
     */
    public void evaluateSafely(CorrelatedGroup group) {
        CallContext.setLinkedId(group.getLinkedId());
        try {
            evaluate(group);
        } catch (StateStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to evaluate call {}", group.getLinkedId(), e);
        } finally {
            CallContext.clear();
        }
    }

    void evaluate(CorrelatedGroup group) {
        synchronized (group) {
            if (group.isEvicted()) {
                return;
            }
            String linkedId = group.getLinkedId();
            if (!aggregateBuilder.hasMinimumData(group)) {
                if (group.isClosed()) {
                    log.debug("Call {} closed without enough data to ship", linkedId);
                    group.setSettled(true);
                }
                return;
            }
            boolean firstEvaluation = group.getAggregate() == null;
            CallAggregate aggregate = aggregateBuilder.build(group, group.getAggregate());
            group.setAggregate(aggregate);
            CallContext.setTenant(aggregate.getTenant());

            String hash = aggregateHasher.hash(aggregate);
            ShippingState state = dedupStore.getState(linkedId, deliveryQueue.isQueued(linkedId));
            if (firstEvaluation && state.phase() == ShippingPhase.SHIPPED_COMPLETE) {
                group.setReopened(true);
            }
            ShippingDecision decision = stateMachine.decide(state, group.isClosed(), hash, runningTime(group));
            if (decision.ship() && decision.corrective() && group.isReopened()) {
                // A re-read call never corrects, it only completes a delivery interrupted by a restart
                decision = state.undelivered()
                        ? ShippingDecision.ship(state.phase(), "redeliver", state.heartbeatCount())
                        : ShippingDecision.skip("reopened");
            }

            if (!decision.ship()) {
                log.trace("Call {} not shipped: {}", linkedId, decision.reason());
                if (state.phase() == ShippingPhase.SHIPPED_COMPLETE && !state.undelivered()) {
                    group.setSettled(true);
                }
                return;
            }
            ship(group, aggregate, decision, hash);
        }
    }

    private void ship(CorrelatedGroup group, CallAggregate aggregate, ShippingDecision decision, String hash) {
        CallAggregate shipment = aggregate.toBuilder()
                .shippingPhase(decision.phase())
                .complete(decision.phase() == ShippingPhase.SHIPPED_COMPLETE)
                .longCall(aggregate.isLongCall() || decision.heartbeatCount() > 0)
                .shippedAt(clock.instant())
                .build();
        dedupStore.recordShipment(group.getLinkedId(), decision, hash);
        if (!deliveryQueue.enqueue(shipment, hash)) {
            // Stays pending in the store and is offered again by the sweep
            return;
        }
        if (decision.phase() == ShippingPhase.SHIPPED_COMPLETE) {
            group.setSettled(true);
        }
        log.debug("Queued {} shipment of call {} ({}, {} threads)", decision.phase().getWireName(),
                group.getLinkedId(), decision.reason(), shipment.getCallThreadsCount());
    }

    public boolean isHeartbeatDue(CorrelatedGroup group) {
        synchronized (group) {
            return stateMachine.heartbeatsDue(runningTime(group)) > 0;
        }
    }

    private Duration runningTime(CorrelatedGroup group) {
        Instant started = group.getEarliestEventTime();
        if (started == null) {
            return Duration.ZERO;
        }
        Duration running = Duration.between(started, clock.instant());
        return running.isNegative() ? Duration.ZERO : running;
    }
}
