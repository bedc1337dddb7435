package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.dedup.WatermarkService;
import com.infomedia.abacox.callshipping.component.feed.FeedAdapter;
import com.infomedia.abacox.callshipping.component.feed.FeedException;
import com.infomedia.abacox.callshipping.component.feed.FeedRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * On a fresh start (no watermark stored) sets the watermark to the newest record in the source,
 * so history already in the PBX database is never shipped. Failing to do so aborts startup.
 */
@Component
@Order(0)
@Log4j2
@RequiredArgsConstructor
public class StartupWatermarkInitializer implements ApplicationRunner {

    private final WatermarkService watermarkService;
    private final FeedRegistry feedRegistry;
    private final EngineConfigService engineConfig;
    private final Clock clock;

    private volatile boolean ready;

    @Override
    public void run(ApplicationArguments args) {
        if (!engineConfig.isFeedEnabled()) {
            log.info("Feeds are disabled, no watermark needed");
            ready = true;
            return;
        }
        Optional<Instant> existing = watermarkService.getWatermark();
        if (existing.isPresent()) {
            log.info("Resuming with watermark {}", existing.get());
            ready = true;
            return;
        }
        Instant watermark = sourceMaxTimestamp().orElseGet(clock::instant);
        watermarkService.setWatermark(watermark);
        log.info("Fresh start: records at or before {} will not be shipped", watermark);
        ready = true;
    }

    Optional<Instant> sourceMaxTimestamp() {
        Instant max = null;
        for (FeedAdapter feed : feedRegistry.activeFeeds()) {
            try {
                Optional<Instant> feedMax = feed.maxTimestamp();
                if (feedMax.isPresent() && (max == null || feedMax.get().isAfter(max))) {
                    max = feedMax.get();
                }
            } catch (FeedException e) {
                throw new IllegalStateException("Cannot initialise the watermark, feed " + feed.name() + " is unavailable", e);
            }
        }
        return Optional.ofNullable(max);
    }

    public boolean isReady() {
        return ready;
    }
}
