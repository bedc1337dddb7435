package com.infomedia.abacox.callshipping.component.feed;

import com.infomedia.abacox.callshipping.component.normalizer.RecordType;

import java.time.Instant;
import java.util.Optional;

/**
 * A resumable source of raw CDR or CEL records. Records are returned in source order and
 * {@link #fetchSince} with the returned cursor continues exactly after the last record.
 */
public interface FeedAdapter {

    /**
     * Stable name, used as the checkpoint key.
     */
    String name();

    RecordType recordType();

    FeedBatch fetchSince(FeedCursor cursor, int limit) throws FeedException;

    /**
     * Time of the most recent record in the source, used as the fresh-start watermark.
     */
    Optional<Instant> maxTimestamp() throws FeedException;

    boolean linkedIdExists(String linkedId) throws FeedException;

    /**
     * Cursor to start from on a fresh start, right after the watermark.
     */
    default FeedCursor cursorAfter(Instant watermark) {
        return watermark == null ? FeedCursor.start() : FeedCursor.atTimestamp(watermark);
    }

    /**
     * Whether a stored checkpoint can be replayed after a restart.
     */
    default boolean isResumable() {
        return true;
    }
}
