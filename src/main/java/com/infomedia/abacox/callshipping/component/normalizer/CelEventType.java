package com.infomedia.abacox.callshipping.component.normalizer;

public enum CelEventType {
    CHAN_START,
    CHAN_END,
    ANSWER,
    HANGUP,
    BRIDGE_ENTER,
    BRIDGE_EXIT,
    APP_START,
    APP_END,
    PARK_START,
    PARK_END,
    BLINDTRANSFER,
    ATTENDEDTRANSFER,
    PICKUP,
    FORWARD,
    LOCAL_OPTIMIZE,
    USER_DEFINED,
    LINKEDID_END,
    OTHER;

    public static CelEventType parse(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    public boolean isTransfer() {
        return this == BLINDTRANSFER || this == ATTENDEDTRANSFER;
    }
}
