package com.infomedia.abacox.callshipping.component.engine;

import com.infomedia.abacox.callshipping.component.EngineFixtures;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.dedup.WatermarkService;
import com.infomedia.abacox.callshipping.component.feed.FeedAdapter;
import com.infomedia.abacox.callshipping.component.feed.FeedException;
import com.infomedia.abacox.callshipping.component.feed.FeedRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.infomedia.abacox.callshipping.component.EngineFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StartupWatermarkInitializerTest {

    private WatermarkService watermarkService;
    private FeedRegistry feedRegistry;
    private FeedAdapter cdrFeed;
    private FeedAdapter celFeed;
    private StartupWatermarkInitializer initializer;

    @BeforeEach
    void setUp() {
        watermarkService = mock(WatermarkService.class);
        feedRegistry = mock(FeedRegistry.class);
        cdrFeed = mock(FeedAdapter.class);
        celFeed = mock(FeedAdapter.class);
        when(feedRegistry.activeFeeds()).thenReturn(List.of(cdrFeed, celFeed));
        when(watermarkService.getWatermark()).thenReturn(Optional.empty());
        initializer = new StartupWatermarkInitializer(watermarkService, feedRegistry, EngineFixtures.config(),
                Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void testFreshStartUsesNewestSourceRecord() throws FeedException {
        when(cdrFeed.maxTimestamp()).thenReturn(Optional.of(T0.minusSeconds(60)));
        when(celFeed.maxTimestamp()).thenReturn(Optional.of(T0.minusSeconds(10)));

        initializer.run(null);

        verify(watermarkService).setWatermark(T0.minusSeconds(10));
        assertTrue(initializer.isReady());
    }

    @Test
    void testEmptySourceUsesCurrentTime() throws FeedException {
        when(cdrFeed.maxTimestamp()).thenReturn(Optional.empty());
        when(celFeed.maxTimestamp()).thenReturn(Optional.empty());

        initializer.run(null);

        verify(watermarkService).setWatermark(T0);
    }

    @Test
    void testExistingWatermarkIsKept() {
        when(watermarkService.getWatermark()).thenReturn(Optional.of(T0.minusSeconds(3600)));

        initializer.run(null);

        verify(watermarkService, never()).setWatermark(any());
        verifyNoInteractions(cdrFeed, celFeed);
        assertTrue(initializer.isReady());
    }

    @Test
    void testUnreachableSourceAbortsStartup() throws FeedException {
        when(cdrFeed.name()).thenReturn("cdr");
        when(cdrFeed.maxTimestamp()).thenThrow(new FeedException("Communications link failure"));

        assertThrows(IllegalStateException.class, () -> initializer.run(null));

        verify(watermarkService, never()).setWatermark(any());
        assertFalse(initializer.isReady());
    }

    @Test
    void testDisabledFeedsNeedNoWatermark() {
        StartupWatermarkInitializer disabled = new StartupWatermarkInitializer(watermarkService, feedRegistry,
                EngineFixtures.config(Map.of(ConfigKey.FEED_ENABLED, "false")), Clock.fixed(T0, ZoneOffset.UTC));

        disabled.run(null);

        assertTrue(disabled.isReady());
        verifyNoInteractions(watermarkService);
    }
}
