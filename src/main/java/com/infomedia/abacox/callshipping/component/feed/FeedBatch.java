package com.infomedia.abacox.callshipping.component.feed;

import java.util.List;

/**
 * Records read from a feed in source order, and the cursor to continue from.
 */
public record FeedBatch(List<RawRecord> records, FeedCursor nextCursor) {

    public static FeedBatch empty(FeedCursor cursor) {
        return new FeedBatch(List.of(), cursor);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
