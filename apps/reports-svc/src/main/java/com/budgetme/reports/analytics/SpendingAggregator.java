package com.budgetme.reports.analytics;

import com.budgetme.reports.category.CategoryResolver;
import com.budgetme.reports.model.CategoryBucket;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.PeriodAggregate;
import com.budgetme.reports.model.SavingsPoint;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TransactionKind;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class SpendingAggregator {

    public static final String UNCATEGORIZED = "Uncategorized";

    static final String UNCATEGORIZED_COLOR = "#858796";
    static final List<String> PALETTE = List.of("#4e73df", "#1cc88a", "#36b9cc", "#f6c23e", "#e74a3b", "#6f42c1");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final DateTimeFormatter PERIOD_LABEL = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    /**
     * Expense totals per category in first-seen order, with unresolvable categories summed into a trailing
     * "Uncategorized" bucket.
     */
    public List<CategoryBucket> aggregateSpending(List<Transaction> transactions, CategoryResolver categoryResolver) {
        Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
        BigDecimal uncategorizedTotal = BigDecimal.ZERO;
        boolean hasUncategorized = false;
        for (Transaction tx : transactions) {
            if (tx.kind() != TransactionKind.EXPENSE) {
                continue;
            }
            String name = tx.categoryId().flatMap(categoryResolver::resolveName).orElse(null);
            if (name == null) {
                uncategorizedTotal = uncategorizedTotal.add(tx.amount());
                hasUncategorized = true;
            } else {
                byCategory.merge(name, tx.amount(), BigDecimal::add);
            }
        }

        List<CategoryBucket> buckets = new ArrayList<>(byCategory.size() + 1);
        int index = 0;
        for (Map.Entry<String, BigDecimal> entry : byCategory.entrySet()) {
            buckets.add(new CategoryBucket(entry.getKey(), entry.getValue(), PALETTE.get(index % PALETTE.size())));
            index++;
        }
        if (hasUncategorized) {
            buckets.add(new CategoryBucket(UNCATEGORIZED, uncategorizedTotal, UNCATEGORIZED_COLOR));
        }
        return List.copyOf(buckets);
    }

    /**
     * Monthly income, expense and contribution sums, truncated to the trailing window of the granularity.
     */
    public List<PeriodAggregate> aggregatePeriods(List<Transaction> transactions, Granularity granularity) {
        Map<YearMonth, BigDecimal[]> monthly = new TreeMap<>();
        for (Transaction tx : transactions) {
            BigDecimal[] sums = monthly.computeIfAbsent(YearMonth.from(tx.date()),
                    month -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO});
            switch (tx.kind()) {
                case INCOME -> sums[0] = sums[0].add(tx.amount());
                case EXPENSE -> sums[1] = sums[1].add(tx.amount());
                case CONTRIBUTION -> sums[2] = sums[2].add(tx.amount());
                case TRANSFER -> {
                    // transfers only open the month bucket
                }
            }
        }
        List<PeriodAggregate> all = new ArrayList<>(monthly.size());
        monthly.forEach((month, sums) -> all.add(new PeriodAggregate(label(month), month, sums[0], sums[1], sums[2])));
        int from = Math.max(0, all.size() - granularity.monthBuckets());
        return List.copyOf(all.subList(from, all.size()));
    }

    public BigDecimal computeSavingsRate(PeriodAggregate aggregate) {
        return savingsRate(aggregate.income(), aggregate.expenses());
    }

    public List<SavingsPoint> savingsSeries(List<Transaction> transactions, Granularity granularity) {
        return aggregatePeriods(transactions, granularity).stream()
                .map(period -> new SavingsPoint(
                        period.periodLabel(),
                        period.income(),
                        period.expenses(),
                        period.net(),
                        computeSavingsRate(period).setScale(1, RoundingMode.HALF_UP)))
                .toList();
    }

    /**
     * Six months after {@code today}, each carrying the average monthly income and expense of the trailing year.
     */
    public List<PeriodAggregate> projectPeriods(List<Transaction> transactions, LocalDate today) {
        LocalDate historyStart = today.minusMonths(PeriodWindows.PREDICTION_HISTORY_MONTHS);
        Map<YearMonth, BigDecimal[]> monthly = new TreeMap<>();
        for (Transaction tx : transactions) {
            if (tx.date().isBefore(historyStart) || tx.date().isAfter(today)) {
                continue;
            }
            if (tx.kind() != TransactionKind.INCOME && tx.kind() != TransactionKind.EXPENSE) {
                continue;
            }
            BigDecimal[] sums = monthly.computeIfAbsent(YearMonth.from(tx.date()),
                    month -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            int slot = tx.kind() == TransactionKind.INCOME ? 0 : 1;
            sums[slot] = sums[slot].add(tx.amount());
        }
        BigDecimal averageIncome = BigDecimal.ZERO;
        BigDecimal averageExpenses = BigDecimal.ZERO;
        if (!monthly.isEmpty()) {
            BigDecimal months = BigDecimal.valueOf(monthly.size());
            BigDecimal income = monthly.values().stream().map(sums -> sums[0]).reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal expenses = monthly.values().stream().map(sums -> sums[1]).reduce(BigDecimal.ZERO, BigDecimal::add);
            averageIncome = income.divide(months, 2, RoundingMode.HALF_UP);
            averageExpenses = expenses.divide(months, 2, RoundingMode.HALF_UP);
        }
        List<PeriodAggregate> projections = new ArrayList<>(6);
        YearMonth current = YearMonth.from(today);
        for (int i = 1; i <= 6; i++) {
            YearMonth month = current.plusMonths(i);
            projections.add(new PeriodAggregate(label(month), month, averageIncome, averageExpenses, BigDecimal.ZERO));
        }
        return List.copyOf(projections);
    }

    static BigDecimal savingsRate(BigDecimal income, BigDecimal expenses) {
        if (income == null || income.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal spent = expenses == null ? BigDecimal.ZERO : expenses;
        return income.subtract(spent).multiply(HUNDRED).divide(income, 2, RoundingMode.HALF_UP);
    }

    static String label(YearMonth month) {
        return PERIOD_LABEL.format(month);
    }
}
