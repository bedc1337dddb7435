package com.infomedia.abacox.callshipping.component.normalizer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.infomedia.abacox.callshipping.component.feed.FeedCursor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * One lifecycle event within a channel's life.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class CelRecord implements NormalizedRecord {
    private final CelEventType eventType;
    /** Event name as received, kept for types not modelled by {@link CelEventType}. */
    private final String eventName;
    private final Instant eventTime;
    private final String linkedId;
    private final String uniqueId;
    private final Long sequence;
    private final String cidName;
    private final String cidNum;
    private final String cidAni;
    private final String cidRdnis;
    private final String cidDnid;
    private final String exten;
    private final String context;
    private final String chanName;
    private final String appName;
    private final String appData;
    private final String accountCode;
    private final String peer;
    private final String userDefType;
    private final String extra;
    @JsonIgnore
    private final String feedName;
    @JsonIgnore
    private final FeedCursor cursor;

    @Override
    public RecordType getType() {
        return RecordType.CEL;
    }
}
