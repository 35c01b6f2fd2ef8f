package com.budgetme.reports.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.budgetme.reports.model.CategoryBucket;
import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.PeriodAggregate;
import com.budgetme.reports.model.ReportData;
import com.budgetme.reports.model.ReportKind;
import com.budgetme.reports.model.SavingsPoint;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TransactionKind;
import com.budgetme.reports.model.TrendEntry;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class FallbackInsightGeneratorTest {

    private final FallbackInsightGenerator generator = new FallbackInsightGenerator("₱", 0.10d);

    @Test
    void spendingReportFlagsConcentratedTopCategory() {
        ReportData data = new ReportData.SpendingReport(List.of(
                bucket("Food", "600"),
                bucket("Transport", "200"),
                bucket("Entertainment", "100"),
                bucket("Uncategorized", "100")));

        List<Insight> insights = generator.generate(data, List.of());

        assertThat(insights).extracting(Insight::id).containsExactly("top-spending", "spending-diversity", "tip");
        Insight top = insights.get(0);
        assertThat(top.category()).isEqualTo(Insight.Category.WARNING);
        assertThat(top.title()).isEqualTo("Highest Spending: Food");
        assertThat(top.description()).contains("60.0%").contains("₱600.00");
        assertThat(insights.get(1).description()).contains("90%").contains("diversifying");
        assertThat(insights.get(2).title()).isEqualTo("Spending Tip");
    }

    @Test
    void emptyReportStillYieldsTip() {
        List<Insight> insights = generator.generate(new ReportData.GoalContributionReport(0, BigDecimal.ZERO), List.of());

        assertThat(insights).singleElement().satisfies(tip -> {
            assertThat(tip.category()).isEqualTo(Insight.Category.TIP);
            assertThat(tip.title()).isEqualTo("Goals Tip");
        });
    }

    @Test
    void cashFlowDeficitWithStableIncome() {
        ReportData data = new ReportData.IncomeExpenseReport(List.of(
                period(4, "1000", "800"),
                period(5, "1000", "900"),
                period(6, "1000", "1250")));

        List<Insight> insights = generator.generate(data, List.of());

        assertThat(insights).extracting(Insight::id).containsExactly("cash-flow", "income-stability", "tip");
        Insight cashFlow = insights.get(0);
        assertThat(cashFlow.title()).isEqualTo("Negative Cash Flow");
        assertThat(cashFlow.description()).contains("Deficit of ₱250.00");
        assertThat(cashFlow.actionText()).contains("Review Budget");
        assertThat(insights.get(1).title()).isEqualTo("Stable Income");
    }

    @Test
    void savingsAboveBenchmarkIsSuccess() {
        ReportData data = new ReportData.SavingsReport(List.of(
                new SavingsPoint("Jun 2025", new BigDecimal("1000"), new BigDecimal("750"), new BigDecimal("250"), new BigDecimal("25.0"))));

        List<Insight> insights = generator.generate(data, List.of());

        assertThat(insights.get(0).id()).isEqualTo("savings-rate");
        assertThat(insights.get(0).category()).isEqualTo(Insight.Category.SUCCESS);
        assertThat(insights.get(0).title()).isEqualTo("25.0% Savings Rate");
        assertThat(insights.get(0).actionable()).isFalse();
    }

    @Test
    void trendsReportBiggestMovers() {
        ReportData data = new ReportData.TrendReport(List.of(
                new TrendEntry("Entertainment", new BigDecimal("50"), new BigDecimal("100"), new BigDecimal("100")),
                new TrendEntry("Transport", new BigDecimal("100"), BigDecimal.ZERO, new BigDecimal("-100"))));

        List<Insight> insights = generator.generate(data, List.of());

        assertThat(insights).extracting(Insight::title)
                .containsExactly("Entertainment Spending Up", "Transport Spending Down", "Trend Tip");
    }

    @Test
    void uncategorizedWarningAboveThreshold() {
        List<Transaction> transactions = List.of(
                tx(TransactionKind.EXPENSE, null),
                tx(TransactionKind.EXPENSE, "food"),
                tx(TransactionKind.TRANSFER, null));

        Optional<Insight> warning = generator.uncategorizedWarning(transactions);

        assertThat(warning).hasValueSatisfying(insight -> {
            assertThat(insight.id()).isEqualTo("uncategorized");
            assertThat(insight.description()).startsWith("1 transaction (50%)");
            assertThat(insight.actionText()).contains("Categorize Now");
        });
        assertThat(generator.uncategorizedWarning(List.of(tx(TransactionKind.EXPENSE, "food")))).isEmpty();
    }

    @Test
    void everyReportKindHasTip() {
        for (ReportKind kind : ReportKind.values()) {
            assertThat(FallbackInsightGenerator.tip(kind).category()).isEqualTo(Insight.Category.TIP);
        }
    }

    private CategoryBucket bucket(String name, String amount) {
        return new CategoryBucket(name, new BigDecimal(amount), "#cccccc");
    }

    private PeriodAggregate period(int month, String income, String expenses) {
        YearMonth yearMonth = YearMonth.of(2025, month);
        return new PeriodAggregate(yearMonth.toString(), yearMonth, new BigDecimal(income), new BigDecimal(expenses), BigDecimal.ZERO);
    }

    private Transaction tx(TransactionKind kind, String categoryId) {
        return new Transaction(UUID.randomUUID(), UUID.randomUUID(), BigDecimal.TEN, LocalDate.of(2025, 6, 1), kind,
                Optional.ofNullable(categoryId), Optional.of(UUID.randomUUID()), Optional.empty());
    }
}
