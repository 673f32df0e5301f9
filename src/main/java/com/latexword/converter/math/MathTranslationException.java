package com.latexword.converter.math;

/**
 * Raised when a math fragment cannot be turned into equation markup.
 * Callers fall back to a plain-text rendering.
 */
public class MathTranslationException extends Exception {

    private static final long serialVersionUID = 1L;

    public MathTranslationException(String message) {
        super(message);
    }

    public MathTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
