package com.infomedia.abacox.callshipping.db.entity;

import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;

/**
 * Shipping history of one call, keyed by linked id.
 */
@Entity
@Table(name = "shipping_record")
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class ShippingRecord {

    @Id
    @Column(name = "linked_id", length = 150, nullable = false)
    private String linkedId;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_shipped_phase", nullable = false, length = 20)
    @Builder.Default
    private ShippingPhase lastShippedPhase = ShippingPhase.PENDING;

    @Column(name = "last_shipped_at")
    private Instant lastShippedAt;

    /**
     * Hash of the last aggregate accepted for shipping.
     */
    @Column(name = "content_hash", length = 32)
    private String contentHash;

    @Column(name = "attempt_count", nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private Integer attemptCount = 0;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    /**
     * Long-call updates shipped while the call was open.
     */
    @Column(name = "heartbeat_count", nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private Integer heartbeatCount = 0;

    @Column(name = "corrective_reship_done", nullable = false)
    @ColumnDefault("false")
    @Builder.Default
    private Boolean correctiveReshipDone = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_status", nullable = false, length = 20)
    @Builder.Default
    private DeliveryStatus deliveryStatus = DeliveryStatus.QUEUED;

    @Column(name = "permanently_failed", nullable = false)
    @ColumnDefault("false")
    @Builder.Default
    private Boolean permanentlyFailed = false;

    @Column(name = "complete_shipped_at")
    private Instant completeShippedAt;

    @Column(name = "first_failure_at")
    private Instant firstFailureAt;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum DeliveryStatus {
        QUEUED,
        RETRY_PENDING,
        DELIVERED,
        REJECTED,
        FAILED;

        public boolean isPending() {
            return this == QUEUED || this == RETRY_PENDING;
        }
    }
}
