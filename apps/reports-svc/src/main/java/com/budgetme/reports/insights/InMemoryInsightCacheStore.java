package com.budgetme.reports.insights;

import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.ReportKind;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "budgetme.insights", name = "store", havingValue = "memory")
public class InMemoryInsightCacheStore implements InsightCacheStore {

    private final Map<UUID, Row> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private record Row(InsightCacheEntry entry, long sequence) {}

    @Override
    public InsightCacheEntry insert(InsightCacheEntry entry) {
        rows.put(entry.id(), new Row(entry, sequence.incrementAndGet()));
        return entry;
    }

    @Override
    public Optional<InsightCacheEntry> queryLatestUnexpired(UUID userId, ReportKind reportKind, Granularity granularity, Instant now) {
        return rows.values().stream()
                .filter(row -> row.entry().userId().equals(userId)
                        && row.entry().reportKind() == reportKind
                        && row.entry().granularity() == granularity
                        && row.entry().isLive(now))
                .max(Comparator.comparing((Row row) -> row.entry().generatedAt()).thenComparingLong(Row::sequence))
                .map(Row::entry);
    }

    @Override
    public void incrementAccess(UUID entryId, Instant accessedAt) {
        rows.computeIfPresent(entryId, (id, row) -> new Row(row.entry().accessed(accessedAt), row.sequence()));
    }

    @Override
    public int deleteExpiredBefore(Instant cutoff) {
        int before = rows.size();
        rows.values().removeIf(row -> row.entry().expiresAt().isBefore(cutoff));
        return before - rows.size();
    }
}
