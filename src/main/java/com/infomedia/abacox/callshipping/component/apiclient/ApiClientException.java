package com.infomedia.abacox.callshipping.component.apiclient;

import com.infomedia.abacox.callshipping.component.easyhttp.EasyHttpException;

/**
 * Failure talking to the calls API. The status code is -1 for network errors and timeouts.
 */
public class ApiClientException extends DeliveryException {

    public ApiClientException(EasyHttpException cause) {
        super(DeliveryFailureType.TRANSIENT, -1, "API request failed: " + cause.describeCause(), cause);
    }

    public ApiClientException(IllegalArgumentException cause) {
        super(DeliveryFailureType.TRANSIENT, -1, "API request invalid: " + cause.getMessage(), cause);
    }

    public ApiClientException(int statusCode, String responseBody) {
        super(DeliveryFailureType.fromStatus(statusCode), statusCode, "API responded " + statusCode + ": " + responseBody);
    }
}
