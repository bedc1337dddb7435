package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.dedup.DedupStoreService;
import com.infomedia.abacox.callshipping.component.dedup.ShipmentLogService;
import com.infomedia.abacox.callshipping.component.dedup.StateStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Log4j2
@RequiredArgsConstructor
public class PurgeJob {

    private final DedupStoreService dedupStore;
    private final ShipmentLogService shipmentLog;

    @Scheduled(cron = "${callshipping.shipping.purge-cron:0 15 * * * *}")
    public void purge() {
        try {
            int records = dedupStore.purgeExpired();
            int logs = shipmentLog.purgeExpired();
            log.debug("Purge removed {} shipping records and {} shipment log rows", records, logs);
        } catch (StateStoreException e) {
            log.error("Purge of expired shipping state failed", e);
        }
    }
}
