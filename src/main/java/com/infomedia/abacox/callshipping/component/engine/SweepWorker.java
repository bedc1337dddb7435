package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.correlation.CorrelationIndex;
import com.infomedia.abacox.callshipping.component.dedup.StateStoreException;
import com.infomedia.abacox.callshipping.component.delivery.DeliveryQueueService;
import com.infomedia.abacox.callshipping.component.shipping.ShippingMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic pass over the correlation index: closes quiet calls and ships them, ships long-call
 * heartbeats in complete mode, offers pending shipments again, and evicts settled calls.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class SweepWorker {

    private final CorrelationIndex correlationIndex;
    private final CallPipelineService pipeline;
    private final DeliveryQueueService deliveryQueue;
    private final EngineConfigService engineConfig;
    private final FatalErrorHandler fatalErrorHandler;

    @Scheduled(fixedDelayString = "${callshipping.shipping.sweep-interval-ms:5000}")
    public void sweep() {
        if (fatalErrorHandler.isStopping()) {
            return;
        }
        try {
            CorrelationIndex.SweepResult result = correlationIndex.sweep();
            for (CorrelatedGroup group : result.getNewlyClosed()) {
                pipeline.evaluateSafely(group);
            }
            for (CorrelatedGroup group : result.getUnsettled()) {
                pipeline.evaluateSafely(group);
            }
            if (engineConfig.getShippingMode() == ShippingMode.COMPLETE) {
                for (CorrelatedGroup group : result.getOpen()) {
                    if (pipeline.isHeartbeatDue(group)) {
                        pipeline.evaluateSafely(group);
                    }
                }
            }
            correlationIndex.evictExpired(group -> deliveryQueue.isQueued(group.getLinkedId()));
        } catch (StateStoreException e) {
            fatalErrorHandler.fatal("State store failed during sweep", e);
        }
    }
}
