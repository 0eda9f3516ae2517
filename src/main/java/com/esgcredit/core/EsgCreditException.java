package com.esgcredit.core;

/**
 * Base failure of the evaluation pipeline. Carries the company or product identifier it concerns.
 */
public class EsgCreditException extends RuntimeException {
    private final String subject;

    public EsgCreditException(String subject, String message) {
        super(message);
        this.subject = subject == null ? "" : subject;
    }

    public EsgCreditException(String subject, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject == null ? "" : subject;
    }

    public String subject() {
        return subject;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (subject.isEmpty()) {
            return base;
        }
        return "[" + subject + "] " + base;
    }
}
