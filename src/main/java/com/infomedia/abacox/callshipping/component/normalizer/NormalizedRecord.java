package com.infomedia.abacox.callshipping.component.normalizer;

import com.infomedia.abacox.callshipping.component.feed.FeedCursor;

import java.time.Instant;

/**
 * Common view of a normalized CDR or CEL record.
 */
public interface NormalizedRecord {

    RecordType getType();

    String getLinkedId();

    String getUniqueId();

    /**
     * Source ordering number, may be null when the source does not provide one.
     */
    Long getSequence();

    Instant getEventTime();

    String getFeedName();

    FeedCursor getCursor();
}
