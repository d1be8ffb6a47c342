package com.takeaway.storefront.notification;

public class EventLogWriteException extends RuntimeException {

    private final boolean transientFailure;

    public EventLogWriteException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /** True when the same write may succeed if tried again shortly. */
    public boolean isTransient() {
        return transientFailure;
    }
}
