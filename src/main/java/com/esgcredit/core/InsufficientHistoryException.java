package com.esgcredit.core;

public class InsufficientHistoryException extends EsgCreditException {
    private final int available;
    private final int required;

    public InsufficientHistoryException(String subject, int available, int required) {
        super(subject, "history too short for forecasting: periods=" + available + ", required=" + required);
        this.available = available;
        this.required = required;
    }

    public int available() {
        return available;
    }

    public int required() {
        return required;
    }
}
