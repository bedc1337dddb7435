package com.infomedia.abacox.callshipping.component.easyhttp;

/**
 * The request never produced an HTTP response, or its body could not be built.
 */
public class EasyHttpException extends RuntimeException {

    public EasyHttpException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Simple name and message of the innermost cause, e.g. {@code SocketTimeoutException timeout}.
     */
    public String describeCause() {
        Throwable root = this;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + (root.getMessage() == null ? "" : " " + root.getMessage());
    }
}
