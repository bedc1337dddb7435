package com.infomedia.abacox.callshipping.component.shipping;

import lombok.extern.log4j.Log4j2;

@Log4j2
public enum ShippingMode {
    /** Ship once when the call closes, plus long-call heartbeats. */
    COMPLETE,
    /** Ship initial, update on every material change, complete on close. */
    PROGRESSIVE;

    public static ShippingMode fromString(String value) {
        if (value != null) {
            for (ShippingMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        log.warn("Invalid call shipping mode '{}', defaulting to 'complete'", value);
        return COMPLETE;
    }
}
