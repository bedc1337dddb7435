package com.infomedia.abacox.callshipping.component.correlation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of applying one record to the correlation index.
 */
@Getter
@ToString(exclude = "group")
@AllArgsConstructor
public class GroupHandle {
    private final String linkedId;
    private final CorrelatedGroup group;
    /** False when the record was already part of the group. */
    private final boolean added;
    private final boolean newGroup;
    /** The record arrived after the group had been closed. */
    private final boolean lateArrival;
    private final boolean closed;
    private final CloseReason closeReason;
}
