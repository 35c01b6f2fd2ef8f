package com.budgetme.reports.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record InsightCacheEntry(
        UUID id,
        UUID userId,
        ReportKind reportKind,
        Granularity granularity,
        List<Insight> insights,
        Source source,
        String model,
        Instant generatedAt,
        Instant expiresAt,
        int accessCount,
        Instant lastAccessedAt
) {
    public InsightCacheEntry {
        insights = insights == null ? List.of() : List.copyOf(insights);
    }

    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt);
    }

    public InsightCacheEntry accessed(Instant at) {
        return new InsightCacheEntry(id, userId, reportKind, granularity, insights, source, model,
                generatedAt, expiresAt, accessCount + 1, at);
    }

    public enum Source {
        AI,
        FALLBACK
    }
}
