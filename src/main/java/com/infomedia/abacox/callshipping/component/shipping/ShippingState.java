package com.infomedia.abacox.callshipping.component.shipping;

/**
 * What has already been shipped for a call, as far as the state machine needs to know.
 *
 * @param undelivered the last shipment was accepted for delivery but is neither delivered nor queued anymore,
 *                    which happens after a restart
 */
public record ShippingState(ShippingPhase phase, String contentHash, int heartbeatCount,
                            boolean correctiveReshipDone, boolean undelivered) {

    public static final ShippingState NEW = new ShippingState(ShippingPhase.PENDING, null, 0, false, false);

    public boolean isShipped() {
        return phase != ShippingPhase.PENDING;
    }
}
