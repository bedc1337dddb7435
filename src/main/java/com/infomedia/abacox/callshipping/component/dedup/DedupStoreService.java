package com.infomedia.abacox.callshipping.component.dedup;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.shipping.ShippingDecision;
import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import com.infomedia.abacox.callshipping.component.shipping.ShippingState;
import com.infomedia.abacox.callshipping.db.entity.ShippingRecord;
import com.infomedia.abacox.callshipping.db.entity.ShippingRecord.DeliveryStatus;
import com.infomedia.abacox.callshipping.db.repository.ShippingRecordRepository;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Durable shipping state per linked id. Writes for one linked id are serialized through a lock
 * stripe chosen by its hash, each in its own transaction.
 */
@Service
@Log4j2
public class DedupStoreService {

    private static final int LOCK_STRIPES = 64;

    private final ShippingRecordRepository shippingRecordRepository;
    private final EngineConfigService engineConfig;
    private final Clock clock;
    private final TransactionTemplate txTemplate;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public DedupStoreService(ShippingRecordRepository shippingRecordRepository,
                             EngineConfigService engineConfig,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.shippingRecordRepository = shippingRecordRepository;
        this.engineConfig = engineConfig;
        this.clock = clock;
        this.txTemplate = new TransactionTemplate(transactionManager);
        this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public Optional<ShippingRecord> find(String linkedId) {
        try {
            return shippingRecordRepository.findById(linkedId);
        } catch (DataAccessException e) {
            throw new StateStoreException("Unable to read shipping state of " + linkedId, e);
        }
    }

    /**
     * State for the shipping decision.
     *
     * @param queuedInMemory whether a shipment of this call is currently waiting in the delivery queue
     */
    public ShippingState getState(String linkedId, boolean queuedInMemory) {
        return find(linkedId)
                .map(record -> new ShippingState(
                        record.getLastShippedPhase(),
                        record.getContentHash(),
                        record.getHeartbeatCount(),
                        Boolean.TRUE.equals(record.getCorrectiveReshipDone()),
                        record.getDeliveryStatus().isPending() && !queuedInMemory))
                .orElse(ShippingState.NEW);
    }

    /**
     * Records a shipment handed to the delivery queue. The phase never moves backwards.
     */
    public void recordShipment(String linkedId, ShippingDecision decision, String contentHash) {
        Instant now = clock.instant();
        mutate(linkedId, true, record -> {
            if (decision.phase().compareTo(record.getLastShippedPhase()) >= 0) {
                record.setLastShippedPhase(decision.phase());
            } else {
                log.warn("Ignoring phase regression for call {}: {} after {}", linkedId, decision.phase(), record.getLastShippedPhase());
            }
            record.setContentHash(contentHash);
            record.setHeartbeatCount(Math.max(record.getHeartbeatCount(), decision.heartbeatCount()));
            if (decision.corrective()) {
                record.setCorrectiveReshipDone(true);
            }
            if (decision.phase() == ShippingPhase.SHIPPED_COMPLETE && record.getCompleteShippedAt() == null) {
                record.setCompleteShippedAt(now);
            }
            record.setDeliveryStatus(DeliveryStatus.QUEUED);
            record.setNextRetryAt(null);
        });
    }

    /**
     * Counts one submission of a shipment to the API.
     *
     * @return the attempt number
     */
    public int recordAttempt(String linkedId) {
        Instant now = clock.instant();
        int[] attempt = new int[1];
        mutate(linkedId, false, record -> {
            record.setAttemptCount(record.getAttemptCount() + 1);
            record.setLastShippedAt(now);
            attempt[0] = record.getAttemptCount();
        });
        return attempt[0];
    }

    /**
     * Marks a shipment delivered. The call stays queued while a later phase is still pending.
     */
    public void recordDelivered(String linkedId, ShippingPhase phase, boolean laterShipmentQueued) {
        mutate(linkedId, false, record -> {
            record.setNextRetryAt(null);
            record.setFirstFailureAt(null);
            record.setLastError(null);
            if (!laterShipmentQueued && phase.compareTo(record.getLastShippedPhase()) >= 0) {
                record.setDeliveryStatus(DeliveryStatus.DELIVERED);
            }
        });
    }

    /**
     * Records a transient failure.
     *
     * @return when the continuous failure started
     */
    public Instant recordRetry(String linkedId, Instant nextRetryAt, String error) {
        Instant now = clock.instant();
        Instant[] firstFailure = new Instant[1];
        mutate(linkedId, false, record -> {
            if (record.getFirstFailureAt() == null) {
                record.setFirstFailureAt(now);
            }
            record.setDeliveryStatus(DeliveryStatus.RETRY_PENDING);
            record.setNextRetryAt(nextRetryAt);
            record.setLastError(truncate(error, 500));
            firstFailure[0] = record.getFirstFailureAt();
        });
        return firstFailure[0] == null ? now : firstFailure[0];
    }

    public void recordRejected(String linkedId, String error) {
        mutate(linkedId, false, record -> {
            record.setDeliveryStatus(DeliveryStatus.REJECTED);
            record.setNextRetryAt(null);
            record.setLastError(truncate(error, 500));
        });
    }

    public void recordPermanentFailure(String linkedId, String error) {
        mutate(linkedId, false, record -> {
            record.setDeliveryStatus(DeliveryStatus.FAILED);
            record.setPermanentlyFailed(true);
            record.setNextRetryAt(null);
            record.setLastError(truncate(error, 500));
        });
    }

    public List<ShippingRecord> findPending() {
        return shippingRecordRepository.findByDeliveryStatusIn(EnumSet.of(DeliveryStatus.QUEUED, DeliveryStatus.RETRY_PENDING));
    }

    /**
     * Deletes records of calls that shipped complete longer than the retention ago and need no more delivery.
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(engineConfig.getDedupRetention());
        try {
            Integer deleted = txTemplate.execute(status -> shippingRecordRepository.deleteSettledBefore(
                    ShippingPhase.SHIPPED_COMPLETE, cutoff,
                    EnumSet.of(DeliveryStatus.DELIVERED, DeliveryStatus.REJECTED, DeliveryStatus.FAILED)));
            int count = deleted == null ? 0 : deleted;
            if (count > 0) {
                log.info("Purged {} shipping records completed before {}", count, cutoff);
            }
            return count;
        } catch (DataAccessException e) {
            throw new StateStoreException("Unable to purge shipping records", e);
        }
    }

    private void mutate(String linkedId, boolean createIfMissing, Consumer<ShippingRecord> change) {
        ReentrantLock lock = locks[Math.floorMod(linkedId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            txTemplate.executeWithoutResult(status -> {
                Instant now = clock.instant();
                ShippingRecord record = shippingRecordRepository.findById(linkedId).orElse(null);
                if (record == null) {
                    if (!createIfMissing) {
                        log.debug("No shipping record for call {}, ignoring update", linkedId);
                        return;
                    }
                    record = ShippingRecord.builder()
                            .linkedId(linkedId)
                            .createdAt(now)
                            .build();
                }
                change.accept(record);
                record.setUpdatedAt(now);
                shippingRecordRepository.save(record);
            });
        } catch (DataAccessException e) {
            throw new StateStoreException("Unable to write shipping state of " + linkedId, e);
        } finally {
            lock.unlock();
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) return null;
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
