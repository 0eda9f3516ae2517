package com.esgcredit.core;

/**
 * Broken policy tables (weights, grade buckets, condition registry). Raised while building them, never per request.
 */
public class ConfigurationException extends EsgCreditException {
    public ConfigurationException(String subject, String message) {
        super(subject, message);
    }

    public ConfigurationException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }
}
