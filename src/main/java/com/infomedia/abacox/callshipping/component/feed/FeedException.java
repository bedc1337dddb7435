package com.infomedia.abacox.callshipping.component.feed;

/**
 * The feed source could not be read. The ingestion loop logs it and tries again on the next poll.
 */
public class FeedException extends Exception {

    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
