package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.dedup.StateStoreException;
import com.infomedia.abacox.callshipping.component.feed.FeedAdapter;
import com.infomedia.abacox.callshipping.component.feed.FeedBatch;
import com.infomedia.abacox.callshipping.component.feed.FeedCursor;
import com.infomedia.abacox.callshipping.component.feed.FeedException;
import com.infomedia.abacox.callshipping.component.feed.FeedRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls every active feed and feeds the records through the pipeline, page by page.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class FeedIngestionWorker {

    private static final int MAX_PAGES_PER_POLL = 20;

    private final FeedRegistry feedRegistry;
    private final CursorCheckpointService checkpointService;
    private final PipelineExecutor pipelineExecutor;
    private final StartupWatermarkInitializer startupInitializer;
    private final EngineConfigService engineConfig;
    private final FatalErrorHandler fatalErrorHandler;

    @Scheduled(fixedDelayString = "${callshipping.feed.poll-interval-ms:2000}")
    public void pollFeeds() {
        if (!engineConfig.isFeedEnabled() || !startupInitializer.isReady() || fatalErrorHandler.isStopping()) {
            return;
        }
        for (FeedAdapter feed : feedRegistry.activeFeeds()) {
            try {
                pollFeed(feed);
            } catch (StateStoreException e) {
                fatalErrorHandler.fatal("State store failed while ingesting feed " + feed.name(), e);
                return;
            }
        }
    }

    int pollFeed(FeedAdapter feed) {
        int limit = engineConfig.getPollBatchLimit();
        FeedCursor cursor = checkpointService.currentCursor(feed);
        int total = 0;
        for (int page = 0; page < MAX_PAGES_PER_POLL; page++) {
            FeedBatch batch;
            try {
                batch = feed.fetchSince(cursor, limit);
            } catch (FeedException e) {
                log.warn("Polling feed {} failed: {}", feed.name(), e.getMessage());
                log.debug("Feed failure detail", e);
                break;
            }
            pipelineExecutor.processAll(batch.records());
            cursor = batch.nextCursor();
            checkpointService.advance(feed, cursor);
            total += batch.records().size();
            if (batch.records().size() < limit) {
                break;
            }
        }
        if (total > 0) {
            log.debug("Read {} records from feed {}", total, feed.name());
        }
        return total;
    }
}
