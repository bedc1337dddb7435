package com.infomedia.abacox.callshipping.component.shipping;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Shipping progress of a call. Phases are ordered; a shipped call never moves to a lower one.
 */
@Getter
public enum ShippingPhase {
    PENDING("pending"),
    SHIPPED_INITIAL("initial"),
    SHIPPED_UPDATE("update"),
    SHIPPED_COMPLETE("complete");

    @JsonValue
    private final String wireName;

    ShippingPhase(String wireName) {
        this.wireName = wireName;
    }

    public boolean isAfter(ShippingPhase other) {
        return compareTo(other) > 0;
    }
}
