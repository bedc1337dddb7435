package com.infomedia.abacox.callshipping.service;

import com.infomedia.abacox.callshipping.component.correlation.CorrelatedGroup;
import com.infomedia.abacox.callshipping.component.correlation.CorrelationIndex;
import com.infomedia.abacox.callshipping.component.dedup.DedupStoreService;
import com.infomedia.abacox.callshipping.component.dedup.ShipmentLogService;
import com.infomedia.abacox.callshipping.component.delivery.DeliveryQueueService;
import com.infomedia.abacox.callshipping.component.feed.FeedAdapter;
import com.infomedia.abacox.callshipping.component.feed.FeedException;
import com.infomedia.abacox.callshipping.component.feed.FeedRegistry;
import com.infomedia.abacox.callshipping.db.entity.ShippingRecord;
import com.infomedia.abacox.callshipping.dto.call.CallStatusDto;
import com.infomedia.abacox.callshipping.dto.call.ShipmentLogDto;
import com.infomedia.abacox.callshipping.dto.call.ShippingRecordDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

/**
 * Read-only lookups by linked id, for operators and for the recording and voicemail subsystems
 * that join on it.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class CallLookupService {

    private final CorrelationIndex correlationIndex;
    private final DedupStoreService dedupStore;
    private final ShipmentLogService shipmentLog;
    private final DeliveryQueueService deliveryQueue;
    private final FeedRegistry feedRegistry;

    public CallStatusDto getStatus(String linkedId) {
        Optional<CorrelatedGroup> group = correlationIndex.get(linkedId);
        Optional<ShippingRecord> record = dedupStore.find(linkedId);
        if (group.isEmpty() && record.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Call " + linkedId + " is not known to the engine");
        }
        CallStatusDto.CallStatusDtoBuilder status = CallStatusDto.builder()
                .linkedId(linkedId)
                .inMemory(group.isPresent())
                .queued(deliveryQueue.isQueued(linkedId))
                .shippingRecord(record.map(ShippingRecordDto::of).orElse(null))
                .recentShipments(shipmentLog.recent(linkedId).stream().map(ShipmentLogDto::of).toList());
        group.ifPresent(g -> {
            synchronized (g) {
                status.closed(g.isClosed()).recordCount(g.size());
            }
        });
        return status.build();
    }

    /**
     * Whether any record of the call exists, in memory or in the PBX source.
     */
    public boolean exists(String linkedId) {
        if (correlationIndex.contains(linkedId)) {
            return true;
        }
        for (FeedAdapter feed : feedRegistry.activeFeeds()) {
            try {
                if (feed.linkedIdExists(linkedId)) {
                    return true;
                }
            } catch (FeedException e) {
                log.warn("Feed {} could not be queried for call {}: {}", feed.name(), linkedId, e.getMessage());
            }
        }
        return false;
    }
}
