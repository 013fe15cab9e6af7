/**
 * Sending to the messaging channel failed. Only transient failures (timeouts) are worth retrying.
 */

package com.example.affairsdigest.exception;

public class DeliveryException extends DigestException {
    private final boolean transientFailure;

    public DeliveryException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public DeliveryException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
