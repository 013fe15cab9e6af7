/**
 * A condition that ends the whole run: nothing scraped, nothing extracted,
 * missing delivery credentials or delivery that could not be completed.
 */

package com.example.affairsdigest.exception;

public class PipelineAbortedException extends DigestException {
    public PipelineAbortedException(String message) {
        super(message);
    }

    public PipelineAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
