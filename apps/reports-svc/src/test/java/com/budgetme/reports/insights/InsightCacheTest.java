package com.budgetme.reports.insights;

import static org.assertj.core.api.Assertions.assertThat;

import com.budgetme.reports.config.BudgetmeProperties;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.ReportKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class InsightCacheTest {

    private static final Instant T0 = Instant.parse("2025-06-01T08:00:00Z");

    private final InMemoryInsightCacheStore store = new InMemoryInsightCacheStore();
    private final BudgetmeProperties properties = BudgetmeProperties.defaults();
    private final UUID userId = UUID.randomUUID();

    @Test
    void latestLiveEntryWinsAndEveryHitCountsOnce() {
        InsightCache morning = cacheAt(T0);
        InsightCache noon = cacheAt(T0.plus(Duration.ofHours(4)));
        morning.store(userId, ReportKind.SPENDING, Granularity.MONTH, insights("old"), InsightCacheEntry.Source.FALLBACK, "heuristic");
        InsightCacheEntry newer = noon.store(userId, ReportKind.SPENDING, Granularity.MONTH, insights("new"),
                InsightCacheEntry.Source.AI, "test-model");

        InsightCache later = cacheAt(T0.plus(Duration.ofDays(1)));
        InsightCacheEntry firstHit = later.lookup(userId, ReportKind.SPENDING, Granularity.MONTH).orElseThrow();
        InsightCacheEntry secondHit = later.lookup(userId, ReportKind.SPENDING, Granularity.MONTH).orElseThrow();

        assertThat(firstHit.id()).isEqualTo(newer.id());
        assertThat(firstHit.insights()).extracting(Insight::title).containsExactly("new");
        assertThat(firstHit.accessCount()).isEqualTo(1);
        assertThat(secondHit.accessCount()).isEqualTo(2);
        assertThat(secondHit.lastAccessedAt()).isEqualTo(T0.plus(Duration.ofDays(1)));
    }

    @Test
    void storedEntryExpiresAfterTtl() {
        InsightCache cache = cacheAt(T0);
        InsightCacheEntry entry = cache.store(userId, ReportKind.TRENDS, Granularity.QUARTER, insights("trend"),
                InsightCacheEntry.Source.FALLBACK, "heuristic");

        assertThat(entry.expiresAt()).isEqualTo(T0.plus(cache.ttl()));
        assertThat(entry.accessCount()).isZero();
        assertThat(cacheAt(T0.plus(Duration.ofDays(7)).minusSeconds(1))
                .lookup(userId, ReportKind.TRENDS, Granularity.QUARTER)).isPresent();
        assertThat(cacheAt(T0.plus(Duration.ofDays(7)))
                .lookup(userId, ReportKind.TRENDS, Granularity.QUARTER)).isEmpty();
    }

    @Test
    void lookupIsScopedToUserKindAndGranularity() {
        cacheAt(T0).store(userId, ReportKind.SPENDING, Granularity.MONTH, insights("mine"),
                InsightCacheEntry.Source.FALLBACK, "heuristic");
        InsightCache cache = cacheAt(T0.plusSeconds(60));

        assertThat(cache.lookup(UUID.randomUUID(), ReportKind.SPENDING, Granularity.MONTH)).isEmpty();
        assertThat(cache.lookup(userId, ReportKind.SAVINGS, Granularity.MONTH)).isEmpty();
        assertThat(cache.lookup(userId, ReportKind.SPENDING, Granularity.YEAR)).isEmpty();
        assertThat(cache.lookup(userId, ReportKind.SPENDING, Granularity.MONTH)).isPresent();
    }

    @Test
    void retentionRemovesOnlyExpiredEntries() {
        cacheAt(T0).store(userId, ReportKind.SPENDING, Granularity.MONTH, insights("old"),
                InsightCacheEntry.Source.FALLBACK, "heuristic");
        cacheAt(T0.plus(Duration.ofDays(5))).store(userId, ReportKind.SPENDING, Granularity.MONTH, insights("fresh"),
                InsightCacheEntry.Source.FALLBACK, "heuristic");
        Clock eightDaysLater = Clock.fixed(T0.plus(Duration.ofDays(8)), ZoneOffset.UTC);

        int removed = new InsightCacheRetentionManager(store, eightDaysLater).purgeExpiredNow();

        assertThat(removed).isEqualTo(1);
        assertThat(cacheAt(T0.plus(Duration.ofDays(8))).lookup(userId, ReportKind.SPENDING, Granularity.MONTH))
                .hasValueSatisfying(entry -> assertThat(entry.insights()).extracting(Insight::title).containsExactly("fresh"));
    }

    private InsightCache cacheAt(Instant instant) {
        return new InsightCache(store, properties, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private List<Insight> insights(String title) {
        return List.of(Insight.of("insight-0", Insight.Category.INFO, title, "description"));
    }
}
