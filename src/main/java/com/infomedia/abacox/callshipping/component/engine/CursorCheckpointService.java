package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.correlation.CorrelationIndex;
import com.infomedia.abacox.callshipping.component.dedup.StateStoreException;
import com.infomedia.abacox.callshipping.component.dedup.WatermarkService;
import com.infomedia.abacox.callshipping.component.delivery.DeliveryQueueService;
import com.infomedia.abacox.callshipping.component.feed.FeedAdapter;
import com.infomedia.abacox.callshipping.component.feed.FeedCursor;
import com.infomedia.abacox.callshipping.component.feed.FeedRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read position of every feed, and the resume checkpoint persisted for it. The checkpoint is the
 * earliest record of any call not yet delivered, so a restart re-reads those calls whole.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class CursorCheckpointService {

    private final WatermarkService watermarkService;
    private final CorrelationIndex correlationIndex;
    private final DeliveryQueueService deliveryQueue;
    private final FeedRegistry feedRegistry;

    private final Map<String, FeedCursor> readPositions = new ConcurrentHashMap<>();

    public FeedCursor currentCursor(FeedAdapter feed) {
        return readPositions.computeIfAbsent(feed.name(), name -> initialCursor(feed));
    }

    private FeedCursor initialCursor(FeedAdapter feed) {
        Optional<FeedCursor> checkpoint = feed.isResumable() ? watermarkService.getCheckpoint(feed.name()) : Optional.empty();
        if (checkpoint.isPresent()) {
            log.info("Feed {} resumes from checkpoint {}", feed.name(), checkpoint.get().serialize());
            return checkpoint.get();
        }
        FeedCursor start = feed.cursorAfter(watermarkService.getWatermark().orElse(null));
        log.info("Feed {} starts at {}", feed.name(), start.serialize());
        return start;
    }

    public void advance(FeedAdapter feed, FeedCursor cursor) {
        readPositions.put(feed.name(), cursor);
    }

    /**
     * Checkpoint to persist for a feed: the earliest unsettled record, or the read position.
     */
    FeedCursor checkpointFor(String feedName, Map<String, FeedCursor> lowWaterMarks) {
        return FeedCursor.min(lowWaterMarks.get(feedName), readPositions.get(feedName));
    }

    @Scheduled(fixedDelayString = "${callshipping.feed.checkpoint-interval-ms:10000}")
    public void persistCheckpoints() {
        if (readPositions.isEmpty()) {
            return;
        }
        Map<String, FeedCursor> lowWaterMarks = correlationIndex.unsettledLowWaterMarks(
                group -> deliveryQueue.isQueued(group.getLinkedId()));
        for (FeedAdapter feed : feedRegistry.activeFeeds()) {
            if (!feed.isResumable() || !readPositions.containsKey(feed.name())) {
                continue;
            }
            FeedCursor checkpoint = checkpointFor(feed.name(), lowWaterMarks);
            if (checkpoint != null) {
                watermarkService.saveCheckpoint(feed.name(), checkpoint);
            }
        }
    }

    @PreDestroy
    public void persistOnShutdown() {
        try {
            persistCheckpoints();
            log.info("Feed checkpoints saved");
        } catch (StateStoreException e) {
            log.error("Could not save feed checkpoints on shutdown", e);
        }
    }
}
