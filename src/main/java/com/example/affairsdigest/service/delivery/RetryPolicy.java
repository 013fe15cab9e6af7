/**
 * Bounded retry of delivery calls. Only transient failures are retried; the wait before attempt
 * n+1 is initialDelay + (n - 1) * increment, so a zero increment gives a fixed backoff.
 */

package com.example.affairsdigest.service.delivery;

import com.example.affairsdigest.exception.DeliveryException;

import java.time.Duration;
import java.util.logging.Logger;

public class RetryPolicy {
    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration increment;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration increment, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.increment = increment;
        this.sleeper = sleeper;
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, Duration.ZERO, Sleeper.THREAD);
    }

    public static RetryPolicy linear(int maxAttempts, Duration initialDelay, Duration increment) {
        return new RetryPolicy(maxAttempts, initialDelay, increment, Sleeper.THREAD);
    }

    public Duration delayAfter(int attempt) {
        return initialDelay.plus(increment.multipliedBy(attempt - 1L));
    }

    public void execute(String action, DeliveryCall call, Logger logger) throws DeliveryException {
        DeliveryException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                call.run();
                return;
            } catch (DeliveryException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                last = e;
                logger.warning(action + " timed out on attempt " + attempt + "/" + maxAttempts + " (" + e.getMessage() + ")");
                if (attempt < maxAttempts) {
                    try {
                        sleeper.sleep(delayAfter(attempt));
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        throw new DeliveryException(action + " interrupted while waiting to retry", false, interrupted);
                    }
                }
            }
        }
        throw new DeliveryException("All " + maxAttempts + " attempts to " + action + " failed", false, last);
    }

    @FunctionalInterface
    public interface DeliveryCall {
        void run() throws DeliveryException;
    }

    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
