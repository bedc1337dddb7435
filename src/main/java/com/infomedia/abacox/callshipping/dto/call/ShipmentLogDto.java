package com.infomedia.abacox.callshipping.dto.call;

import com.infomedia.abacox.callshipping.db.entity.ShipmentLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for {@link ShipmentLog}
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ShipmentLogDto {
    private String phase;
    private String outcome;
    private Integer attempt;
    private Integer httpStatus;
    private String contentHash;
    private String message;
    private Instant createdAt;

    public static ShipmentLogDto of(ShipmentLog log) {
        return ShipmentLogDto.builder()
                .phase(log.getPhase())
                .outcome(log.getOutcome().name())
                .attempt(log.getAttempt())
                .httpStatus(log.getHttpStatus())
                .contentHash(log.getContentHash())
                .message(log.getMessage())
                .createdAt(log.getCreatedAt())
                .build();
    }
}
