package com.infomedia.abacox.callshipping.component.feed;

import com.infomedia.abacox.callshipping.component.normalizer.RecordType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Map;

/**
 * One record as read from a feed, keyed by the PBX column names in lower case
 * ({@code calldate}, {@code linkedid}, {@code eventtype}, ...).
 */
@Getter
@Builder
@ToString
public class RawRecord {
    private final RecordType type;
    private final String feedName;
    @Singular
    private final Map<String, String> fields;
    private final FeedCursor cursor;

    public String get(String field) {
        return fields.get(field);
    }
}
