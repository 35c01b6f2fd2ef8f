package com.budgetme.reports.insights;

import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.ReportKind;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface InsightCacheStore {

    InsightCacheEntry insert(InsightCacheEntry entry);

    /**
     * The entry with the latest {@code generatedAt} whose expiry lies after {@code now}.
     */
    Optional<InsightCacheEntry> queryLatestUnexpired(UUID userId, ReportKind reportKind, Granularity granularity, Instant now);

    void incrementAccess(UUID entryId, Instant accessedAt);

    int deleteExpiredBefore(Instant cutoff);
}
