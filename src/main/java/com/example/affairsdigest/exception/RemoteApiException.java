/**
 * The remote document service rejected a call (auth, quota, malformed range) or was unreachable.
 * statusCode is -1 when no HTTP response was received.
 */

package com.example.affairsdigest.exception;

public class RemoteApiException extends DigestException {
    private final int statusCode;

    public RemoteApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
