package com.infomedia.abacox.callshipping.component.classification;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum CallDirection {
    INBOUND("inbound"),
    OUTBOUND("outbound"),
    INTERNAL("internal"),
    UNKNOWN("unknown");

    private final String value;

    CallDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
