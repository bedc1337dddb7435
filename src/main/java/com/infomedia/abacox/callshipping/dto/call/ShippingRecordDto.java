package com.infomedia.abacox.callshipping.dto.call;

import com.infomedia.abacox.callshipping.db.entity.ShippingRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for {@link ShippingRecord}
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ShippingRecordDto {
    private String linkedId;
    private String lastShippedPhase;
    private Instant lastShippedAt;
    private String contentHash;
    private Integer attemptCount;
    private Instant nextRetryAt;
    private Integer heartbeatCount;
    private Boolean correctiveReshipDone;
    private String deliveryStatus;
    private Boolean permanentlyFailed;
    private Instant completeShippedAt;
    private Instant firstFailureAt;
    private String lastError;

    public static ShippingRecordDto of(ShippingRecord record) {
        return ShippingRecordDto.builder()
                .linkedId(record.getLinkedId())
                .lastShippedPhase(record.getLastShippedPhase().getWireName())
                .lastShippedAt(record.getLastShippedAt())
                .contentHash(record.getContentHash())
                .attemptCount(record.getAttemptCount())
                .nextRetryAt(record.getNextRetryAt())
                .heartbeatCount(record.getHeartbeatCount())
                .correctiveReshipDone(record.getCorrectiveReshipDone())
                .deliveryStatus(record.getDeliveryStatus().name())
                .permanentlyFailed(record.getPermanentlyFailed())
                .completeShippedAt(record.getCompleteShippedAt())
                .firstFailureAt(record.getFirstFailureAt())
                .lastError(record.getLastError())
                .build();
    }
}
