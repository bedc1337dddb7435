package com.infomedia.abacox.callshipping.component.apiclient;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one batch submission.
 *
 * @param accepted       linked ids the API accepted
 * @param rejected       linked ids rejected with the reason given by the API
 * @param failure        set when the whole batch failed
 * @param statusCode     HTTP status, -1 when no response was received
 */
public record SubmitResult(List<String> accepted, Map<String, String> rejected, DeliveryException failure, int statusCode) {

    public static SubmitResult success(List<String> accepted, Map<String, String> rejected, int statusCode) {
        return new SubmitResult(List.copyOf(accepted), Map.copyOf(rejected), null, statusCode);
    }

    public static SubmitResult failed(DeliveryException failure) {
        return new SubmitResult(List.of(), Map.of(), failure, failure.getStatusCode());
    }

    public boolean isRetryable() {
        return failure != null && failure.getFailureType() == DeliveryFailureType.TRANSIENT;
    }

    public boolean isRejected() {
        return failure != null && failure.getFailureType() == DeliveryFailureType.REJECTED;
    }
}
