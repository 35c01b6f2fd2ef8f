package com.budgetme.reports.reports;

public enum SessionState {
    IDLE,
    AGGREGATING,
    ANOMALY_SCANNING,
    INSIGHT_FETCHING
}
