package com.budgetme.reports.model;

import java.util.Locale;

public enum Granularity {
    MONTH(6),
    QUARTER(12),
    YEAR(36);

    private final int monthBuckets;

    Granularity(int monthBuckets) {
        this.monthBuckets = monthBuckets;
    }

    /**
     * Number of trailing monthly buckets kept by period aggregation.
     */
    public int monthBuckets() {
        return monthBuckets;
    }

    public static Granularity parse(String value) {
        if (value == null || value.isBlank()) {
            return MONTH;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported granularity: " + value);
        }
    }
}
