package com.budgetme.reports.ai;

public class InsightResponseParseException extends Exception {

    public InsightResponseParseException(String message) {
        super(message);
    }

    public InsightResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
