package com.infomedia.abacox.callshipping.component.classification;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Call features observed anywhere in the group.
 */
@Getter
@Builder
@ToString
public class CallFeatures {
    private final boolean transferred;
    private final boolean queueCall;
    private final boolean voicemail;
    private final boolean ivr;
    private final boolean parked;
    private final boolean conference;
    private final boolean anonymousCaller;
}
