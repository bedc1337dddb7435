package com.infomedia.abacox.callshipping.component.normalizer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.infomedia.abacox.callshipping.component.feed.FeedCursor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * One terminal leg of a call, as summarized by the PBX.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class CdrRecord implements NormalizedRecord {
    private final String uniqueId;
    private final String linkedId;
    private final Long sequence;
    private final Instant startTime;
    private final Instant answerTime;
    private final Instant endTime;
    private final String src;
    private final String dst;
    /** Caller id name parsed from the CDR clid column. */
    private final String callerIdName;
    private final String context;
    private final String dcontext;
    private final String channel;
    private final String dstChannel;
    private final String lastApp;
    private final String lastData;
    private final long duration;
    private final long billSec;
    private final Disposition disposition;
    private final String accountCode;
    private final String userField;
    private final String peerAccount;
    @JsonIgnore
    private final String feedName;
    @JsonIgnore
    private final FeedCursor cursor;

    @Override
    public RecordType getType() {
        return RecordType.CDR;
    }

    @Override
    public Instant getEventTime() {
        return startTime;
    }
}
