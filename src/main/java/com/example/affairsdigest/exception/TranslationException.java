package com.example.affairsdigest.exception;

public class TranslationException extends DigestException {
    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
