package com.latexword.converter.export;

/**
 * Fatal conversion failure: unreadable input, unwritable output or a broken
 * document package. Recoverable content problems never raise this.
 */
public class ConversionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
