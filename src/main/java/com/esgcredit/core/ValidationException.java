package com.esgcredit.core;

/**
 * Malformed or out-of-range input: indicator values, series, supplier records or catalog entries.
 */
public class ValidationException extends EsgCreditException {
    public ValidationException(String subject, String message) {
        super(subject, message);
    }

    public ValidationException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }
}
