/**
 * No layout strategy could make sense of a page's markup.
 */

package com.example.affairsdigest.exception;

public class StructuralMismatchException extends DigestException {
    public StructuralMismatchException(String message) {
        super(message);
    }
}
