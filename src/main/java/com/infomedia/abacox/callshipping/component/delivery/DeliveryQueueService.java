package com.infomedia.abacox.callshipping.component.delivery;

import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.metrics.EngineMetrics;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory delivery queue with one FIFO lane per linked id. Only the head of a lane can be
 * submitted, so shipments of one call are delivered in phase order while different calls
 * are batched freely.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class DeliveryQueueService {

    private final EngineConfigService engineConfig;
    private final EngineMetrics metrics;
    private final Clock clock;

    private final Map<String, Deque<DeliveryItem>> lanes = new LinkedHashMap<>();
    private int size;

    @PostConstruct
    public void registerGauges() {
        metrics.registerGauge("callshipping.queue.depth", "Shipments waiting for delivery", this::size);
    }

    /**
     * Adds a shipment at the end of its call's lane. A queued shipment of the same phase that
     * has not been submitted yet is replaced by the newer content instead.
     *
     * @return false when the queue is full
     */
    public synchronized boolean enqueue(CallAggregate aggregate, String contentHash) {
        Deque<DeliveryItem> lane = lanes.get(aggregate.getLinkedId());
        if (lane != null && !lane.isEmpty()) {
            DeliveryItem tail = lane.peekLast();
            if (!tail.isInFlight() && !tail.isRetry() && tail.getPhase() == aggregate.getShippingPhase()) {
                tail.replacePayload(aggregate, contentHash);
                log.debug("Replaced queued {} shipment of call {}", tail.getPhase(), tail.getLinkedId());
                return true;
            }
        }
        if (size >= engineConfig.getQueueCapacity()) {
            log.warn("Delivery queue full ({} items), shipment of call {} deferred", size, aggregate.getLinkedId());
            return false;
        }
        lanes.computeIfAbsent(aggregate.getLinkedId(), id -> new ArrayDeque<>())
                .addLast(new DeliveryItem(aggregate, contentHash, clock.instant()));
        size++;
        return true;
    }

    /**
     * Takes up to {@code max} lane heads that are ready for submission and marks them in flight.
     * Retries come before first attempts.
     */
    public synchronized List<DeliveryItem> drain(int max) {
        Instant now = clock.instant();
        List<DeliveryItem> batch = new ArrayList<>(Math.min(max, size));
        for (boolean retries : new boolean[]{true, false}) {
            for (Deque<DeliveryItem> lane : lanes.values()) {
                if (batch.size() >= max) {
                    break;
                }
                DeliveryItem head = lane.peekFirst();
                if (head != null && head.isRetry() == retries && head.isReady(now)) {
                    head.markInFlight();
                    batch.add(head);
                }
            }
        }
        return batch;
    }

    /**
     * Removes a delivered, rejected or abandoned shipment from the head of its lane.
     */
    public synchronized void remove(DeliveryItem item) {
        Deque<DeliveryItem> lane = lanes.get(item.getLinkedId());
        if (lane == null || lane.peekFirst() != item) {
            log.warn("Shipment {} is not at the head of its lane", item);
            return;
        }
        lane.removeFirst();
        size--;
        if (lane.isEmpty()) {
            lanes.remove(item.getLinkedId());
        }
    }

    public synchronized void scheduleRetry(DeliveryItem item, Instant failedAt, Instant nextAttemptAt) {
        item.scheduleRetry(failedAt, nextAttemptAt);
    }

    /**
     * Whether a later shipment of the same call waits behind this one.
     */
    public synchronized boolean hasLaterShipment(DeliveryItem item) {
        Deque<DeliveryItem> lane = lanes.get(item.getLinkedId());
        return lane != null && lane.size() > 1;
    }

    public synchronized boolean isQueued(String linkedId) {
        return lanes.containsKey(linkedId);
    }

    public synchronized int size() {
        return size;
    }

    public synchronized int readyCount() {
        Instant now = clock.instant();
        int ready = 0;
        for (Deque<DeliveryItem> lane : lanes.values()) {
            DeliveryItem head = lane.peekFirst();
            if (head != null && head.isReady(now)) {
                ready++;
            }
        }
        return ready;
    }

    public synchronized boolean hasDueRetry() {
        Instant now = clock.instant();
        for (Deque<DeliveryItem> lane : lanes.values()) {
            DeliveryItem head = lane.peekFirst();
            if (head != null && head.isRetry() && head.isReady(now)) {
                return true;
            }
        }
        return false;
    }

    /**
     * How long the oldest ready first attempt has been waiting, zero when there is none.
     */
    public synchronized Duration oldestReadyWait() {
        Instant now = clock.instant();
        Instant oldest = null;
        for (Deque<DeliveryItem> lane : lanes.values()) {
            DeliveryItem head = lane.peekFirst();
            if (head != null && head.isReady(now) && (oldest == null || head.getEnqueuedAt().isBefore(oldest))) {
                oldest = head.getEnqueuedAt();
            }
        }
        return oldest == null ? Duration.ZERO : Duration.between(oldest, now);
    }

    public synchronized Instant earliestRetryAt() {
        Instant now = clock.instant();
        Instant earliest = null;
        for (Deque<DeliveryItem> lane : lanes.values()) {
            DeliveryItem head = lane.peekFirst();
            if (head != null && head.isWaitingForRetry(now)
                    && (earliest == null || head.getNextAttemptAt().isBefore(earliest))) {
                earliest = head.getNextAttemptAt();
            }
        }
        return earliest;
    }
}
