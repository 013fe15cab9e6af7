/**
 * A page or image could not be fetched (network error, timeout or non-success HTTP status).
 */

package com.example.affairsdigest.exception;

public class FetchException extends DigestException {
    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
