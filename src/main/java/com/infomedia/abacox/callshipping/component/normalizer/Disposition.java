package com.infomedia.abacox.callshipping.component.normalizer;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum Disposition {
    ANSWERED("ANSWERED"),
    NO_ANSWER("NO ANSWER"),
    BUSY("BUSY"),
    FAILED("FAILED"),
    CONGESTION("CONGESTION"),
    UNKNOWN("");

    private final String pbxValue;

    Disposition(String pbxValue) {
        this.pbxValue = pbxValue;
    }

    @JsonValue
    public String getPbxValue() {
        return pbxValue;
    }

    /**
     * Parses the PBX spelling ({@code NO ANSWER}) as well as the enum name ({@code NO_ANSWER}).
     */
    public static Disposition parse(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase().replace('_', ' ');
        for (Disposition d : values()) {
            if (d != UNKNOWN && d.pbxValue.equals(normalized)) {
                return d;
            }
        }
        return UNKNOWN;
    }

    public boolean isTerminal() {
        return this != UNKNOWN;
    }
}
