package com.infomedia.abacox.callshipping.component.apiclient;

public enum DeliveryFailureType {
    /** Network error, timeout or server error. Retried with backoff. */
    TRANSIENT,
    /** Client error. The data is not accepted and is never retried. */
    REJECTED;

    public static DeliveryFailureType fromStatus(int statusCode) {
        return statusCode >= 400 && statusCode < 500 ? REJECTED : TRANSIENT;
    }
}
