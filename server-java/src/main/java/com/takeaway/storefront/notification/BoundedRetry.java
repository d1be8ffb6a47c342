package com.takeaway.storefront.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs an action up to {@code maxAttempts} times. After failed attempt {@code n} it waits
 * {@code n * baseDelay} before trying again. Failures the predicate does not accept as
 * retryable are rethrown immediately.
 */
public class BoundedRetry {

    private static final Logger logger = LoggerFactory.getLogger(BoundedRetry.class);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public BoundedRetry(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    public Duration delayAfter(int attempt) {
        return baseDelay.multipliedBy(attempt);
    }

    /**
     * @throws RetryExhaustedException when every attempt failed with a retryable error
     */
    public <T> T call(String operation, Supplier<T> action, Predicate<RuntimeException> retryable) {
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                lastError = e;
                logger.warn("{} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    pause(operation, delayAfter(attempt), e);
                }
            }
        }
        throw new RetryExhaustedException(operation, maxAttempts, lastError);
    }

    private void pause(String operation, Duration delay, RuntimeException lastError) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            RetryExhaustedException interrupted = new RetryExhaustedException(operation + " (interrupted)", 0, lastError);
            interrupted.addSuppressed(ie);
            throw interrupted;
        }
    }
}
