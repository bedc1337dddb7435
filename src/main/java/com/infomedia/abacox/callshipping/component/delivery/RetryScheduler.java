package com.infomedia.abacox.callshipping.component.delivery;

import com.infomedia.abacox.callshipping.component.dedup.DedupStoreService;
import com.infomedia.abacox.callshipping.db.entity.ShippingRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Wakes the batch worker when the earliest backed-off shipment becomes due, so retries go out
 * ahead of new shipments without waiting for a full batch.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class RetryScheduler {

    private final DeliveryQueueService queue;
    private final DeliveryBatchWorker batchWorker;
    private final DedupStoreService dedupStore;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${callshipping.delivery.retry-check-interval-ms:1000}")
    public void releaseDueRetries() {
        Instant earliest = queue.earliestRetryAt();
        boolean due = queue.hasDueRetry();
        if (!due) {
            if (earliest != null && log.isTraceEnabled()) {
                log.trace("Next retry due at {}", earliest);
            }
            return;
        }
        int batches = batchWorker.flush(false);
        log.debug("Released due retries in {} batches", batches);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void reportPendingFromPreviousRun() {
        List<ShippingRecord> pending = dedupStore.findPending();
        if (pending.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        long overdue = pending.stream()
                .filter(r -> r.getNextRetryAt() == null || !r.getNextRetryAt().isAfter(now))
                .count();
        log.info("{} shipments were pending at the last shutdown ({} due now); they are redelivered as their calls are re-read",
                pending.size(), overdue);
    }
}
