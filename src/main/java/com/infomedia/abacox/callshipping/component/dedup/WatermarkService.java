package com.infomedia.abacox.callshipping.component.dedup;

import com.infomedia.abacox.callshipping.component.feed.FeedCursor;
import com.infomedia.abacox.callshipping.db.entity.EngineState;
import com.infomedia.abacox.callshipping.db.repository.EngineStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Startup watermark and per-feed resume checkpoints, kept in {@code engine_state}.
 * Records at or before the watermark are never processed.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class WatermarkService {

    static final String WATERMARK_KEY = "watermark";
    static final String CHECKPOINT_PREFIX = "checkpoint.";

    private final EngineStateRepository engineStateRepository;
    private final Clock clock;

    private volatile Instant cachedWatermark;
    private volatile boolean loaded;

    public Optional<Instant> getWatermark() {
        if (!loaded) {
            cachedWatermark = readValue(WATERMARK_KEY).map(WatermarkService::parseInstant).orElse(null);
            loaded = true;
        }
        return Optional.ofNullable(cachedWatermark);
    }

    public boolean hasWatermark() {
        return getWatermark().isPresent();
    }

    @Transactional
    public void setWatermark(Instant watermark) {
        writeValue(WATERMARK_KEY, watermark.toString());
        cachedWatermark = watermark;
        loaded = true;
        log.info("Watermark set to {}", watermark);
    }

    /**
     * True when the record time is after the watermark. Records without a time pass.
     */
    public boolean isAfterWatermark(Instant eventTime) {
        Optional<Instant> watermark = getWatermark();
        if (watermark.isEmpty() || eventTime == null) {
            return true;
        }
        return eventTime.isAfter(watermark.get());
    }

    public Optional<FeedCursor> getCheckpoint(String feedName) {
        return readValue(CHECKPOINT_PREFIX + feedName).map(FeedCursor::parse);
    }

    @Transactional
    public void saveCheckpoint(String feedName, FeedCursor cursor) {
        writeValue(CHECKPOINT_PREFIX + feedName, cursor.serialize());
    }

    private Optional<String> readValue(String key) {
        try {
            return engineStateRepository.findById(key).map(EngineState::getValue);
        } catch (DataAccessException e) {
            throw new StateStoreException("Unable to read engine state " + key, e);
        }
    }

    private void writeValue(String key, String value) {
        try {
            EngineState state = engineStateRepository.findById(key)
                    .orElseGet(() -> EngineState.builder().key(key).build());
            state.setValue(value);
            state.setUpdatedAt(clock.instant());
            engineStateRepository.save(state);
        } catch (DataAccessException e) {
            throw new StateStoreException("Unable to write engine state " + key, e);
        }
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Stored watermark '{}' is not a valid instant, ignoring it", value);
            return null;
        }
    }
}
