package com.infomedia.abacox.callshipping.component.delivery;

import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;
import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * One shipment of a call waiting for delivery. Mutable fields are only touched under the queue monitor.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class DeliveryItem {

    @ToString.Include
    private final String linkedId;
    @ToString.Include
    private final ShippingPhase phase;
    private final Instant enqueuedAt;
    private CallAggregate aggregate;
    private String contentHash;

    @ToString.Include
    private int failures;
    private Instant nextAttemptAt;
    private Instant firstFailureAt;
    private boolean inFlight;

    public DeliveryItem(CallAggregate aggregate, String contentHash, Instant enqueuedAt) {
        this.linkedId = aggregate.getLinkedId();
        this.phase = aggregate.getShippingPhase();
        this.aggregate = aggregate;
        this.contentHash = contentHash;
        this.enqueuedAt = enqueuedAt;
    }

    public boolean isRetry() {
        return failures > 0;
    }

    boolean isReady(Instant now) {
        return !inFlight && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }

    boolean isWaitingForRetry(Instant now) {
        return !inFlight && nextAttemptAt != null && nextAttemptAt.isAfter(now);
    }

    void replacePayload(CallAggregate aggregate, String contentHash) {
        this.aggregate = aggregate;
        this.contentHash = contentHash;
    }

    void markInFlight() {
        inFlight = true;
    }

    void scheduleRetry(Instant failedAt, Instant nextAttemptAt) {
        inFlight = false;
        failures++;
        if (firstFailureAt == null) {
            firstFailureAt = failedAt;
        }
        this.nextAttemptAt = nextAttemptAt;
    }
}
