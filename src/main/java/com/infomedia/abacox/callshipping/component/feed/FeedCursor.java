package com.infomedia.abacox.callshipping.component.feed;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;

/**
 * Resume position within a feed. Table feeds use the timestamp plus a tie-break key or id,
 * the CSV feed uses the byte offset and the event stream uses a sequence number.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class FeedCursor implements Comparable<FeedCursor> {

    private static final Comparator<FeedCursor> ORDER = Comparator
            .comparing(FeedCursor::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(FeedCursor::getPosition)
            .thenComparing(FeedCursor::getKey, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final FeedCursor START = new FeedCursor(null, 0L, null);

    private final Instant timestamp;
    private final long position;
    private final String key;

    private FeedCursor(Instant timestamp, long position, String key) {
        this.timestamp = timestamp;
        this.position = position;
        this.key = key;
    }

    public static FeedCursor start() {
        return START;
    }

    public static FeedCursor of(Instant timestamp, long position, String key) {
        return new FeedCursor(timestamp, position, key == null || key.isEmpty() ? null : key);
    }

    public static FeedCursor atTimestamp(Instant timestamp) {
        return new FeedCursor(timestamp, 0L, null);
    }

    public static FeedCursor atPosition(long position) {
        return new FeedCursor(null, position, null);
    }

    @Override
    public int compareTo(FeedCursor other) {
        return ORDER.compare(this, other);
    }

    public static FeedCursor min(FeedCursor a, FeedCursor b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Stable text form stored in the engine state table: {@code timestamp|position|key}.
     */
    public String serialize() {
        return (timestamp == null ? "" : timestamp.toString()) + "|" + position + "|" + (key == null ? "" : key);
    }

    public static FeedCursor parse(String text) {
        if (text == null || text.isBlank()) {
            return START;
        }
        String[] parts = text.split("\\|", 3);
        try {
            Instant ts = parts[0].isEmpty() ? null : Instant.parse(parts[0]);
            long pos = parts.length > 1 && !parts[1].isEmpty() ? Long.parseLong(parts[1]) : 0L;
            String key = parts.length > 2 ? parts[2] : null;
            return of(ts, pos, key);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Malformed feed cursor: " + text, e);
        }
    }
}
