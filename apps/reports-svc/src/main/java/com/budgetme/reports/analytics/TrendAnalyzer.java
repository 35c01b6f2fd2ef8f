package com.budgetme.reports.analytics;

import com.budgetme.reports.category.CategoryResolver;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TrendEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class TrendAnalyzer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Clock clock;

    public TrendAnalyzer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Entries ordered by absolute percent change, largest first; ties keep category insertion order.
     */
    public List<TrendEntry> computeTrends(List<Transaction> transactions, CategoryResolver categoryResolver, Granularity granularity) {
        LocalDate today = LocalDate.now(clock);
        PeriodWindows.Window currentWindow = PeriodWindows.current(granularity, today);
        PeriodWindows.Window previousWindow = PeriodWindows.previous(granularity, today);

        List<Transaction> current = new ArrayList<>();
        List<Transaction> previous = new ArrayList<>();
        for (Transaction tx : transactions) {
            if (!tx.kind().categorizable()) {
                continue;
            }
            if (currentWindow.contains(tx.date())) {
                current.add(tx);
            } else if (previousWindow.contains(tx.date())) {
                previous.add(tx);
            }
        }

        Map<String, BigDecimal[]> totals = new LinkedHashMap<>();
        boolean hasUncategorized = false;
        for (List<Transaction> window : List.of(current, previous)) {
            for (Transaction tx : window) {
                String name = categoryName(tx, categoryResolver);
                if (name == null) {
                    hasUncategorized = true;
                } else {
                    totals.computeIfAbsent(name, key -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
                }
            }
        }
        if (hasUncategorized) {
            totals.computeIfAbsent(SpendingAggregator.UNCATEGORIZED, key -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
        }

        accumulate(current, 0, totals, categoryResolver);
        accumulate(previous, 1, totals, categoryResolver);

        List<TrendEntry> trends = new ArrayList<>(totals.size());
        totals.forEach((category, sums) -> trends.add(
                new TrendEntry(category, sums[1], sums[0], percentChange(sums[1], sums[0]))));
        trends.sort(Comparator.comparing((TrendEntry entry) -> entry.percentChange().abs()).reversed());
        return List.copyOf(trends);
    }

    /**
     * (current - previous) / previous * 100; 100 when only the current period has spend, 0 when neither has.
     */
    public static BigDecimal percentChange(BigDecimal previous, BigDecimal current) {
        if (previous.signum() > 0) {
            return current.subtract(previous).multiply(HUNDRED).divide(previous, 2, RoundingMode.HALF_UP);
        }
        if (current.signum() > 0) {
            return HUNDRED.setScale(2, RoundingMode.UNNECESSARY);
        }
        return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
    }

    private void accumulate(List<Transaction> window, int slot, Map<String, BigDecimal[]> totals, CategoryResolver categoryResolver) {
        for (Transaction tx : window) {
            String name = categoryName(tx, categoryResolver);
            BigDecimal[] sums = totals.get(name != null ? name : SpendingAggregator.UNCATEGORIZED);
            sums[slot] = sums[slot].add(tx.amount());
        }
    }

    private String categoryName(Transaction tx, CategoryResolver categoryResolver) {
        return tx.categoryId().flatMap(categoryResolver::resolveName).orElse(null);
    }
}
