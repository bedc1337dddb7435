package com.infomedia.abacox.callshipping.component.correlation;

public enum CloseReason {
    /** A LINKEDID_END event was observed. */
    LINKEDID_END,
    /** Every channel that started has hung up and the group went quiet. */
    ALL_CHANNELS_HUNG_UP,
    /** No record arrived for the quiescence interval. */
    QUIESCENT,
    /** All CDR legs carry a final disposition and CEL completion is not required. */
    CDR_TERMINAL
}
