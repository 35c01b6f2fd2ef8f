package com.budgetme.reports.insights;

import com.budgetme.reports.config.BudgetmeProperties;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.ReportKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * TTL-bounded cache of generated insights keyed by (user, report kind, granularity). Entries are never updated;
 * regeneration appends a newer one.
 */
@Component
public class InsightCache {

    private static final Logger log = LoggerFactory.getLogger(InsightCache.class);

    private final InsightCacheStore store;
    private final Duration ttl;
    private final Clock clock;

    public InsightCache(InsightCacheStore store, BudgetmeProperties properties, Clock clock) {
        this.store = store;
        this.ttl = Duration.ofDays(properties.insights().ttlDays());
        this.clock = clock;
    }

    /**
     * Most recent live entry; each hit counts as one access.
     */
    public Optional<InsightCacheEntry> lookup(UUID userId, ReportKind reportKind, Granularity granularity) {
        Instant now = clock.instant();
        Optional<InsightCacheEntry> hit = store.queryLatestUnexpired(userId, reportKind, granularity, now);
        if (hit.isEmpty()) {
            log.debug("Insight cache miss: user={} report={} granularity={}", userId, reportKind.code(), granularity);
            return Optional.empty();
        }
        InsightCacheEntry entry = hit.get();
        store.incrementAccess(entry.id(), now);
        log.debug("Insight cache hit: entry={} accessCount={}", entry.id(), entry.accessCount() + 1);
        return Optional.of(entry.accessed(now));
    }

    public InsightCacheEntry store(
            UUID userId,
            ReportKind reportKind,
            Granularity granularity,
            List<Insight> insights,
            InsightCacheEntry.Source source,
            String model) {
        Instant now = clock.instant();
        InsightCacheEntry entry = new InsightCacheEntry(
                UUID.randomUUID(),
                userId,
                reportKind,
                granularity,
                insights,
                source,
                model,
                now,
                now.plus(ttl),
                0,
                null);
        return store.insert(entry);
    }

    Duration ttl() {
        return ttl;
    }
}
