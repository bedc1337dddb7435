package com.infomedia.abacox.callshipping.component.apiclient;

import lombok.Getter;

@Getter
public class DeliveryException extends RuntimeException {

    private final DeliveryFailureType failureType;
    private final int statusCode;

    public DeliveryException(DeliveryFailureType failureType, int statusCode, String message) {
        super(message);
        this.failureType = failureType;
        this.statusCode = statusCode;
    }

    public DeliveryException(DeliveryFailureType failureType, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.failureType = failureType;
        this.statusCode = statusCode;
    }
}
