package com.infomedia.abacox.callshipping.component.feed;

import lombok.extern.log4j.Log4j2;

/**
 * Transport the CEL records are read from.
 */
@Log4j2
public enum CelMode {
    DB,
    CSV,
    AMI,
    NONE;

    public static CelMode fromString(String value) {
        if (value != null) {
            for (CelMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        log.warn("Unknown CEL mode '{}', CEL ingestion disabled", value);
        return NONE;
    }
}
