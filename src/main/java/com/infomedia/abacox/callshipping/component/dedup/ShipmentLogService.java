package com.infomedia.abacox.callshipping.component.dedup;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import com.infomedia.abacox.callshipping.component.shipping.ShippingPhase;
import com.infomedia.abacox.callshipping.db.entity.ShipmentLog;
import com.infomedia.abacox.callshipping.db.repository.ShipmentLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@Log4j2
@RequiredArgsConstructor
public class ShipmentLogService {

    private final ShipmentLogRepository shipmentLogRepository;
    private final EngineConfigService engineConfig;
    private final Clock clock;

    public void log(String linkedId, ShippingPhase phase, ShipmentLog.Outcome outcome, int attempt,
                    Integer httpStatus, String contentHash, String message) {
        try {
            shipmentLogRepository.save(ShipmentLog.builder()
                    .linkedId(linkedId)
                    .phase(phase.getWireName())
                    .outcome(outcome)
                    .attempt(attempt)
                    .httpStatus(httpStatus)
                    .contentHash(contentHash)
                    .message(message != null && message.length() > 500 ? message.substring(0, 500) : message)
                    .createdAt(clock.instant())
                    .build());
        } catch (Exception e) {
            log.error("Could not write shipment log for call {}: {}", linkedId, e.getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<ShipmentLog> recent(String linkedId) {
        return shipmentLogRepository.findTop20ByLinkedIdOrderByCreatedAtDesc(linkedId);
    }

    @Transactional
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(engineConfig.getShipmentLogRetention());
        int deleted = shipmentLogRepository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            log.info("Purged {} shipment log entries older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
