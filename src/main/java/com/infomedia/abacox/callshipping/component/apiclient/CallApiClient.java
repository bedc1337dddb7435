package com.infomedia.abacox.callshipping.component.apiclient;

import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;

import java.util.List;

/**
 * Submits batches of call aggregates to the remote calls API.
 */
public interface CallApiClient {

    /**
     * Submits one batch. Never throws for HTTP or network failures; those are reported
     * through the result.
     */
    SubmitResult submit(List<CallAggregate> batch);
}
