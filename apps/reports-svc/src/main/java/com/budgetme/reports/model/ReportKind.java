package com.budgetme.reports.model;

import java.util.Locale;

public enum ReportKind {
    SPENDING("spending"),
    INCOME_EXPENSE("income-expense"),
    SAVINGS("savings"),
    TRENDS("trends"),
    GOALS("goals"),
    PREDICTIONS("predictions");

    private final String code;

    ReportKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ReportKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("reportKind must be provided");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ReportKind kind : values()) {
            if (kind.code.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported report kind: " + value);
    }
}
