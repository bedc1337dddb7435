package com.infomedia.abacox.callshipping.component.shipping;

public record ShippingDecision(boolean ship, ShippingPhase phase, String reason, int heartbeatCount, boolean corrective) {

    public static ShippingDecision skip(String reason) {
        return new ShippingDecision(false, null, reason, 0, false);
    }

    public static ShippingDecision ship(ShippingPhase phase, String reason, int heartbeatCount) {
        return new ShippingDecision(true, phase, reason, heartbeatCount, false);
    }

    public static ShippingDecision corrective(String reason, int heartbeatCount) {
        return new ShippingDecision(true, ShippingPhase.SHIPPED_COMPLETE, reason, heartbeatCount, true);
    }
}
