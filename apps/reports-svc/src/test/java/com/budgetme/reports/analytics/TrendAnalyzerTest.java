package com.budgetme.reports.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.budgetme.reports.category.InMemoryCategoryResolver;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TransactionKind;
import com.budgetme.reports.model.TrendEntry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TrendAnalyzerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-15T09:00:00Z"), ZoneOffset.UTC);
    private final TrendAnalyzer analyzer = new TrendAnalyzer(clock);
    private final InMemoryCategoryResolver resolver = new InMemoryCategoryResolver(Map.of(
            "food", "Food",
            "transport", "Transport",
            "fun", "Entertainment"));

    @Test
    void percentChangeFromZeroIsOneHundred() {
        assertThat(TrendAnalyzer.percentChange(BigDecimal.ZERO, new BigDecimal("50"))).isEqualByComparingTo("100");
    }

    @Test
    void percentChangeIsRelativeToPrevious() {
        assertThat(TrendAnalyzer.percentChange(new BigDecimal("100"), new BigDecimal("150"))).isEqualByComparingTo("50");
        assertThat(TrendAnalyzer.percentChange(new BigDecimal("100"), BigDecimal.ZERO)).isEqualByComparingTo("-100");
        assertThat(TrendAnalyzer.percentChange(BigDecimal.ZERO, BigDecimal.ZERO)).isEqualByComparingTo("0");
    }

    @Test
    void monthlyTrendsAreOrderedByAbsoluteChangeWithStableTies() {
        List<Transaction> transactions = List.of(
                tx(TransactionKind.EXPENSE, "150", "2025-06-03", "food"),
                tx(TransactionKind.EXPENSE, "50", "2025-06-04", "fun"),
                tx(TransactionKind.EXPENSE, "100", "2025-05-10", "food"),
                tx(TransactionKind.EXPENSE, "100", "2025-05-11", "transport"),
                tx(TransactionKind.EXPENSE, "999", "2025-03-01", "food"));

        List<TrendEntry> trends = analyzer.computeTrends(transactions, resolver, Granularity.MONTH);

        assertThat(trends).extracting(TrendEntry::category)
                .containsExactly("Entertainment", "Transport", "Food");
        assertThat(trends.get(1).percentChange()).isEqualByComparingTo("-100");
        assertThat(trends.get(2).previousAmount()).isEqualByComparingTo("100");
        assertThat(trends.get(2).currentAmount()).isEqualByComparingTo("150");
    }

    @Test
    void uncategorizedBucketIgnoresContributionsAndTransfers() {
        List<Transaction> withTransfers = List.of(
                tx(TransactionKind.EXPENSE, "20", "2025-06-02", "food"),
                tx(TransactionKind.CONTRIBUTION, "200", "2025-06-02", null),
                tx(TransactionKind.TRANSFER, "300", "2025-05-02", null));

        assertThat(analyzer.computeTrends(withTransfers, resolver, Granularity.MONTH))
                .extracting(TrendEntry::category)
                .containsExactly("Food");

        List<Transaction> withUncategorized = List.of(
                tx(TransactionKind.EXPENSE, "20", "2025-05-02", null),
                tx(TransactionKind.EXPENSE, "20", "2025-06-02", "food"));

        assertThat(analyzer.computeTrends(withUncategorized, resolver, Granularity.MONTH))
                .extracting(TrendEntry::category)
                .containsExactly("Food", SpendingAggregator.UNCATEGORIZED);
    }

    @Test
    void quarterCompareAgainstPreviousQuarter() {
        List<Transaction> transactions = List.of(
                tx(TransactionKind.EXPENSE, "300", "2025-04-20", "food"),
                tx(TransactionKind.EXPENSE, "200", "2025-02-20", "food"));

        assertThat(analyzer.computeTrends(transactions, resolver, Granularity.QUARTER))
                .singleElement()
                .satisfies(entry -> assertThat(entry.percentChange()).isEqualByComparingTo("50"));
    }

    private Transaction tx(TransactionKind kind, String amount, String date, String categoryId) {
        return new Transaction(
                UUID.randomUUID(),
                UUID.randomUUID(),
                new BigDecimal(amount),
                LocalDate.parse(date),
                kind,
                Optional.ofNullable(categoryId),
                Optional.empty(),
                Optional.empty());
    }
}
