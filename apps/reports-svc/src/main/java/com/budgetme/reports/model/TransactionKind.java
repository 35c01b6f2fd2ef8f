package com.budgetme.reports.model;

import java.util.Locale;

public enum TransactionKind {
    INCOME,
    EXPENSE,
    CONTRIBUTION,
    TRANSFER;

    /**
     * Income and expense rows are expected to carry a category; contributions and transfers are exempt.
     */
    public boolean categorizable() {
        return this == INCOME || this == EXPENSE;
    }

    public static TransactionKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("type must be provided");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported transaction type: " + value);
        }
    }
}
