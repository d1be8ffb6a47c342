package com.takeaway.storefront.notification;

public class RetryExhaustedException extends RuntimeException {

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super(operation + " failed after " + attempts + " attempt(s): "
                + (lastError != null ? lastError.getMessage() : "unknown error"), lastError);
    }
}
