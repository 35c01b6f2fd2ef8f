package com.budgetme.reports.insights;

import static org.assertj.core.api.Assertions.assertThat;

import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.ReportKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class AiReportRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-06-10T12:00:00Z");

    @Autowired
    private AiReportRepository repository;

    private JpaInsightCacheStore store;
    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        store = new JpaInsightCacheStore(repository, new ObjectMapper());
    }

    @Test
    void roundTripsInsightsAndPicksNewestLiveRow() {
        store.insert(entry(NOW.minus(Duration.ofDays(2)), "Older", InsightCacheEntry.Source.FALLBACK));
        InsightCacheEntry newest = store.insert(entry(NOW.minus(Duration.ofHours(1)), "Newest", InsightCacheEntry.Source.AI));

        InsightCacheEntry found = store.queryLatestUnexpired(userId, ReportKind.SAVINGS, Granularity.MONTH, NOW).orElseThrow();

        assertThat(found.id()).isEqualTo(newest.id());
        assertThat(found.source()).isEqualTo(InsightCacheEntry.Source.AI);
        assertThat(found.model()).isEqualTo("test-model");
        assertThat(found.insights()).singleElement().satisfies(insight -> {
            assertThat(insight.title()).isEqualTo("Newest");
            assertThat(insight.category()).isEqualTo(Insight.Category.WARNING);
            assertThat(insight.actionText()).contains("Review Budget");
        });
        assertThat(store.queryLatestUnexpired(userId, ReportKind.SAVINGS, Granularity.QUARTER, NOW)).isEmpty();
    }

    @Test
    void rowsGeneratedAtTheSameInstantResolveToTheLastInserted() {
        Instant generatedAt = NOW.minus(Duration.ofMinutes(5));
        store.insert(entry(generatedAt, "First", InsightCacheEntry.Source.FALLBACK));
        store.insert(entry(generatedAt, "Second", InsightCacheEntry.Source.FALLBACK));
        InsightCacheEntry third = store.insert(entry(generatedAt, "Third", InsightCacheEntry.Source.AI));

        InsightCacheEntry found = store.queryLatestUnexpired(userId, ReportKind.SAVINGS, Granularity.MONTH, NOW).orElseThrow();

        assertThat(found.id()).isEqualTo(third.id());
        assertThat(found.insights()).singleElement().satisfies(insight -> assertThat(insight.title()).isEqualTo("Third"));
        assertThat(repository.findAll()).extracting(AiReportEntity::getRevision).containsExactlyInAnyOrder(1L, 2L, 3L);
    }

    @Test
    void incrementAccessAndExpiry() {
        InsightCacheEntry entry = store.insert(entry(NOW.minus(Duration.ofDays(1)), "Tracked", InsightCacheEntry.Source.FALLBACK));

        store.incrementAccess(entry.id(), NOW);
        store.incrementAccess(entry.id(), NOW.plusSeconds(30));

        InsightCacheEntry reloaded = store.queryLatestUnexpired(userId, ReportKind.SAVINGS, Granularity.MONTH, NOW).orElseThrow();
        assertThat(reloaded.accessCount()).isEqualTo(2);
        assertThat(reloaded.lastAccessedAt()).isEqualTo(NOW.plusSeconds(30));

        Instant afterExpiry = entry.expiresAt().plusSeconds(1);
        assertThat(store.queryLatestUnexpired(userId, ReportKind.SAVINGS, Granularity.MONTH, afterExpiry)).isEmpty();
        assertThat(store.deleteExpiredBefore(afterExpiry)).isEqualTo(1);
        assertThat(repository.count()).isZero();
    }

    private InsightCacheEntry entry(Instant generatedAt, String title, InsightCacheEntry.Source source) {
        return new InsightCacheEntry(
                UUID.randomUUID(),
                userId,
                ReportKind.SAVINGS,
                Granularity.MONTH,
                List.of(Insight.actionable("insight-0", Insight.Category.WARNING, title, "Savings dipped", "Review Budget")),
                source,
                "test-model",
                generatedAt,
                generatedAt.plus(Duration.ofDays(7)),
                0,
                null);
    }
}
