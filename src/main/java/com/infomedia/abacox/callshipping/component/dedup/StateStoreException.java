package com.infomedia.abacox.callshipping.component.dedup;

/**
 * The persisted shipping state could not be read or written.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
