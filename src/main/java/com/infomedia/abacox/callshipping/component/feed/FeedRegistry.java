package com.infomedia.abacox.callshipping.component.feed;

import com.infomedia.abacox.callshipping.component.engine.EngineConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The feeds the engine reads: the CDR table always, plus the CEL transport selected by the CEL mode.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class FeedRegistry {

    private final CdrTableFeedAdapter cdrFeed;
    private final List<CelFeedAdapter> celFeeds;
    private final EngineConfigService engineConfig;

    public List<FeedAdapter> activeFeeds() {
        List<FeedAdapter> feeds = new ArrayList<>();
        feeds.add(cdrFeed);
        CelMode mode = engineConfig.getCelMode();
        if (mode == CelMode.NONE) {
            return feeds;
        }
        for (CelFeedAdapter celFeed : celFeeds) {
            if (celFeed.celMode() == mode) {
                feeds.add(celFeed);
                return feeds;
            }
        }
        log.warn("No CEL feed available for mode {}", mode);
        return feeds;
    }
}
