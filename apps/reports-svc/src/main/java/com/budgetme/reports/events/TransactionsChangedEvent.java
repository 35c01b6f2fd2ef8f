package com.budgetme.reports.events;

import java.time.Instant;
import java.util.UUID;

public record TransactionsChangedEvent(UUID userId, ChangeType changeType, Instant occurredAt) {

    public enum ChangeType {
        UPSERT,
        DELETE,
        RESET
    }
}
