/**
 * Base type of every checked failure raised by the digest pipeline.
 */

package com.example.affairsdigest.exception;

public class DigestException extends Exception {
    public DigestException(String message) {
        super(message);
    }

    public DigestException(String message, Throwable cause) {
        super(message, cause);
    }
}
