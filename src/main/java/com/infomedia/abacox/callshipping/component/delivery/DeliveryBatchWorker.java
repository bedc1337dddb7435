package com.infomedia.abacox.callshipping.component.delivery;

import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;
import com.infomedia.abacox.callshipping.component.apiclient.CallApiClient;
import com.infomedia.abacox.callshipping.component.apiclient.DeliveryException;
import com.infomedia.abacox.callshipping.component.apiclient.DeliveryFailureType;
import com.infomedia.abacox.callshipping.component.apiclient.SubmitResult;
import com.infomedia.abacox.callshipping.component.dedup.DedupStoreService;
import com.infomedia.abacox.callshipping.component.dedup.ShipmentLogService;
import com.infomedia.abacox.callshipping.component.dedup.StateStoreException;
import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.engine.FatalErrorHandler;
import com.infomedia.abacox.callshipping.component.metrics.EngineMetrics;
import com.infomedia.abacox.callshipping.db.entity.ShipmentLog.Outcome;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Submits queued shipments in batches. A batch goes out once enough shipments are ready, the oldest
 * one has waited the maximum time, or a retry is due. Transient failures are retried with backoff until
 * the retry deadline; client errors are never retried.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class DeliveryBatchWorker {

    private static final int MAX_BATCHES_PER_CYCLE = 50;

    private final DeliveryQueueService queue;
    private final CallApiClient apiClient;
    private final DedupStoreService dedupStore;
    private final ShipmentLogService shipmentLog;
    private final BackoffPolicy backoffPolicy;
    private final EngineConfigService engineConfig;
    private final EngineMetrics metrics;
    private final FatalErrorHandler fatalErrorHandler;
    private final Clock clock;

    private final ReentrantLock submitLock = new ReentrantLock();

    @Scheduled(fixedDelayString = "${callshipping.delivery.poll-interval-ms:1000}")
    public void processDeliveryQueue() {
        flush(false);
    }

    /**
     * Submits every batch whose trigger condition holds.
     *
     * @param force submit whatever is ready without waiting for a full batch
     * @return number of batches submitted
     */
    public int flush(boolean force) {
        if (!engineConfig.isDeliveryEnabled() || fatalErrorHandler.isStopping()) {
            return 0;
        }
        if (!submitLock.tryLock()) {
            return 0;
        }
        try {
            return submitReadyBatches(force);
        } finally {
            submitLock.unlock();
        }
    }

    private int submitReadyBatches(boolean force) {
        int batchSize = engineConfig.getBatchSize();
        int batches = 0;
        while (batches < MAX_BATCHES_PER_CYCLE && shouldSubmit(force, batchSize)) {
            List<DeliveryItem> batch = queue.drain(batchSize);
            if (batch.isEmpty()) {
                break;
            }
            try {
                submitBatch(batch);
            } catch (StateStoreException e) {
                fatalErrorHandler.fatal("Shipping state could not be persisted", e);
                return batches;
            }
            batches++;
        }
        return batches;
    }

    private boolean shouldSubmit(boolean force, int batchSize) {
        int ready = queue.readyCount();
        if (ready == 0) {
            return false;
        }
        return force
                || queue.hasDueRetry()
                || ready >= batchSize
                || queue.oldestReadyWait().compareTo(engineConfig.getBatchMaxWait()) >= 0;
    }

    void submitBatch(List<DeliveryItem> batch) {
        long start = System.currentTimeMillis();
        Map<String, Integer> attempts = new HashMap<>();
        for (DeliveryItem item : batch) {
            attempts.put(item.getLinkedId(), dedupStore.recordAttempt(item.getLinkedId()));
        }
        List<CallAggregate> payload = batch.stream().map(DeliveryItem::getAggregate).toList();

        SubmitResult result;
        try {
            result = apiClient.submit(payload);
        } catch (RuntimeException e) {
            log.error("API client failed on a batch of {} aggregates", batch.size(), e);
            result = SubmitResult.failed(new DeliveryException(DeliveryFailureType.TRANSIENT, -1,
                    "API client error: " + e.getClass().getSimpleName() + " " + e.getMessage(), e));
        }

        if (result.failure() == null) {
            int delivered = 0;
            for (DeliveryItem item : batch) {
                String reason = result.rejected().get(item.getLinkedId());
                if (reason != null) {
                    reject(item, attempts.get(item.getLinkedId()), result.statusCode(), reason);
                } else {
                    deliver(item, attempts.get(item.getLinkedId()), result.statusCode());
                    delivered++;
                }
            }
            log.info("Shipped batch of {} aggregates in {} ms ({} rejected)",
                    delivered, System.currentTimeMillis() - start, batch.size() - delivered);
        } else if (result.isRejected()) {
            log.warn("API rejected batch of {} aggregates: {}", batch.size(), result.failure().getMessage());
            for (DeliveryItem item : batch) {
                reject(item, attempts.get(item.getLinkedId()), result.statusCode(), result.failure().getMessage());
            }
        } else {
            retryOrAbandon(batch, attempts, result);
        }
    }

    private void deliver(DeliveryItem item, int attempt, int statusCode) {
        boolean laterQueued = queue.hasLaterShipment(item);
        queue.remove(item);
        dedupStore.recordDelivered(item.getLinkedId(), item.getPhase(), laterQueued);
        shipmentLog.log(item.getLinkedId(), item.getPhase(), Outcome.DELIVERED, attempt, statusCode, item.getContentHash(), null);
        metrics.shipment(item.getPhase().getWireName(), "delivered");
        log.debug("Delivered {} shipment of call {} on attempt {}", item.getPhase(), item.getLinkedId(), attempt);
    }

    private void reject(DeliveryItem item, int attempt, int statusCode, String reason) {
        log.warn("Shipment {} of call {} rejected by the API ({}): {}", item.getPhase(), item.getLinkedId(), statusCode, reason);
        queue.remove(item);
        dedupStore.recordRejected(item.getLinkedId(), reason);
        shipmentLog.log(item.getLinkedId(), item.getPhase(), Outcome.REJECTED, attempt, statusCode, item.getContentHash(), reason);
        metrics.deliveryRejected();
        metrics.shipment(item.getPhase().getWireName(), "rejected");
    }

    private void retryOrAbandon(List<DeliveryItem> batch, Map<String, Integer> attempts, SubmitResult result) {
        Instant now = clock.instant();
        String error = result.failure().getMessage();
        Integer statusCode = result.statusCode() > 0 ? result.statusCode() : null;
        Duration firstDelay = null;
        int abandoned = 0;
        for (DeliveryItem item : batch) {
            int attempt = attempts.get(item.getLinkedId());
            Duration delay = backoffPolicy.delayAfter(item.getFailures() + 1);
            Instant nextAttemptAt = now.plus(delay);
            Instant firstFailureAt = dedupStore.recordRetry(item.getLinkedId(), nextAttemptAt, error);
            if (item.getFirstFailureAt() != null && item.getFirstFailureAt().isBefore(firstFailureAt)) {
                firstFailureAt = item.getFirstFailureAt();
            }
            if (backoffPolicy.isDeadlineExceeded(firstFailureAt, now)) {
                log.error("Giving up on {} shipment of call {} after {} attempts since {}: {}",
                        item.getPhase(), item.getLinkedId(), attempt, firstFailureAt, error);
                queue.remove(item);
                dedupStore.recordPermanentFailure(item.getLinkedId(), error);
                shipmentLog.log(item.getLinkedId(), item.getPhase(), Outcome.FAILED, attempt, statusCode, item.getContentHash(), error);
                metrics.permanentFailure();
                metrics.shipment(item.getPhase().getWireName(), "failed");
                abandoned++;
                continue;
            }
            queue.scheduleRetry(item, now, nextAttemptAt);
            shipmentLog.log(item.getLinkedId(), item.getPhase(), Outcome.RETRY, attempt, statusCode, item.getContentHash(), error);
            metrics.shipment(item.getPhase().getWireName(), "retry");
            if (firstDelay == null) {
                firstDelay = delay;
            }
        }
        if (abandoned < batch.size()) {
            log.warn("Delivery of {} aggregates failed, retrying in {} s: {}",
                    batch.size() - abandoned, firstDelay == null ? 0 : firstDelay.toSeconds(), error);
        }
    }

    @PreDestroy
    public void drainOnShutdown() {
        if (!engineConfig.isDeliveryEnabled() || queue.size() == 0) {
            return;
        }
        Duration grace = engineConfig.getShutdownGrace();
        Instant deadline = clock.instant().plus(grace);
        log.info("Draining delivery queue ({} shipments) for up to {} s", queue.size(), grace.toSeconds());
        try {
            if (!submitLock.tryLock(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight batch did not finish within the shutdown grace period");
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        try {
            while (clock.instant().isBefore(deadline) && queue.readyCount() > 0) {
                if (submitReadyBatches(true) == 0) {
                    break;
                }
            }
        } finally {
            submitLock.unlock();
        }
        if (queue.size() > 0) {
            log.info("{} shipments left undelivered; they resume from the shipping state on restart", queue.size());
        }
    }
}
