package com.budgetme.reports.ai;

import com.budgetme.reports.config.BudgetmeProperties;
import com.budgetme.reports.model.CategoryBucket;
import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.Insight.Category;
import com.budgetme.reports.model.PeriodAggregate;
import com.budgetme.reports.model.ReportData;
import com.budgetme.reports.model.ReportKind;
import com.budgetme.reports.model.SavingsPoint;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TrendEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Deterministic insights derived from report data alone. Branches without data are omitted; the closing tip is
 * always present.
 */
@Component
public class FallbackInsightGenerator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal CONCENTRATION_SHARE = BigDecimal.valueOf(50);
    private static final BigDecimal DIVERSIFY_SHARE = BigDecimal.valueOf(80);
    private static final BigDecimal SAVINGS_BENCHMARK = BigDecimal.valueOf(20);
    private static final BigDecimal SAVINGS_FLOOR = BigDecimal.valueOf(10);
    private static final BigDecimal PROJECTED_RATE_TARGET = BigDecimal.valueOf(15);
    private static final double INCOME_STABILITY_RATIO = 0.10d;

    private final String symbol;
    private final double uncategorizedThreshold;

    @Autowired
    public FallbackInsightGenerator(BudgetmeProperties properties) {
        this(properties.currency().symbol(), properties.analysis().uncategorizedThreshold());
    }

    FallbackInsightGenerator(String symbol, double uncategorizedThreshold) {
        this.symbol = symbol;
        this.uncategorizedThreshold = uncategorizedThreshold;
    }

    public List<Insight> generate(ReportData reportData, List<Transaction> transactions) {
        List<Insight> insights = new ArrayList<>();
        if (reportData instanceof ReportData.SpendingReport spending) {
            spendingInsights(spending.buckets(), insights);
        } else if (reportData instanceof ReportData.IncomeExpenseReport incomeExpense) {
            cashFlowInsights(incomeExpense.periods(), insights);
        } else if (reportData instanceof ReportData.SavingsReport savings) {
            savingsInsights(savings.points(), insights);
        } else if (reportData instanceof ReportData.TrendReport trends) {
            trendInsights(trends.trends(), insights);
        } else if (reportData instanceof ReportData.GoalContributionReport goals) {
            goalInsights(goals, insights);
        } else if (reportData instanceof ReportData.PredictionReport predictions) {
            predictionInsights(predictions.projections(), insights);
        }
        uncategorizedWarning(transactions).ifPresent(insights::add);
        insights.add(tip(reportData.kind()));
        return List.copyOf(insights);
    }

    private void spendingInsights(List<CategoryBucket> buckets, List<Insight> insights) {
        BigDecimal total = buckets.stream().map(CategoryBucket::totalAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (buckets.isEmpty() || total.signum() <= 0) {
            return;
        }
        List<CategoryBucket> ranked = buckets.stream()
                .sorted(Comparator.comparing(CategoryBucket::totalAmount).reversed())
                .toList();
        CategoryBucket top = ranked.get(0);
        BigDecimal share = share(top.totalAmount(), total);
        boolean concentrated = share.compareTo(CONCENTRATION_SHARE) > 0;
        insights.add(new Insight(
                "top-spending",
                concentrated ? Category.WARNING : Category.INFO,
                "fas fa-chart-pie",
                "Highest Spending: " + top.categoryName(),
                "Your " + top.categoryName() + " expenses account for " + MoneyFormat.percent(share, 1)
                        + "% of total spending (" + money(top.totalAmount()) + "). "
                        + (concentrated ? "This concentration may be risky." : "Consider if this aligns with your priorities."),
                concentrated,
                Optional.empty()));

        if (ranked.size() >= 3) {
            BigDecimal topThree = ranked.subList(0, 3).stream()
                    .map(CategoryBucket::totalAmount)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal topThreeShare = share(topThree, total);
            insights.add(new Insight(
                    "spending-diversity",
                    Category.INFO,
                    "fas fa-layer-group",
                    "Spending Distribution",
                    "Your top 3 categories represent " + MoneyFormat.percent(topThreeShare, 0) + "% of spending. "
                            + (topThreeShare.compareTo(DIVERSIFY_SHARE) > 0
                            ? "Consider diversifying your budget allocation."
                            : "Your spending is well-distributed across categories."),
                    false,
                    Optional.empty()));
        }
    }

    private void cashFlowInsights(List<PeriodAggregate> periods, List<Insight> insights) {
        if (periods.isEmpty()) {
            return;
        }
        PeriodAggregate latest = periods.get(periods.size() - 1);
        BigDecimal cashFlow = latest.net();
        boolean positive = cashFlow.signum() > 0;
        insights.add(new Insight(
                "cash-flow",
                positive ? Category.SUCCESS : Category.WARNING,
                positive ? "fas fa-arrow-up" : "fas fa-arrow-down",
                positive ? "Positive Cash Flow" : "Negative Cash Flow",
                latest.periodLabel() + ": " + (positive ? "Surplus" : "Deficit") + " of " + money(cashFlow.abs()) + ". "
                        + (positive ? "Great job managing your finances!" : "Review expenses to improve cash flow."),
                !positive,
                positive ? Optional.empty() : Optional.of("Review Budget")));

        if (periods.size() >= 3) {
            List<PeriodAggregate> recent = periods.subList(periods.size() - 3, periods.size());
            double average = recent.stream().mapToDouble(p -> p.income().doubleValue()).average().orElse(0d);
            double variance = recent.stream()
                    .mapToDouble(p -> Math.pow(p.income().doubleValue() - average, 2))
                    .average()
                    .orElse(0d);
            boolean stable = average > 0d && Math.sqrt(variance) < average * INCOME_STABILITY_RATIO;
            insights.add(new Insight(
                    "income-stability",
                    stable ? Category.SUCCESS : Category.INFO,
                    "fas fa-chart-line",
                    stable ? "Stable Income" : "Variable Income",
                    "Your income over the last 3 months " + (stable ? "has been consistent" : "shows variation") + ". "
                            + (stable ? "This stability helps with financial planning." : "Consider building a larger emergency fund."),
                    false,
                    Optional.empty()));
        }
    }

    private void savingsInsights(List<SavingsPoint> points, List<Insight> insights) {
        if (points.isEmpty()) {
            return;
        }
        BigDecimal rate = points.get(points.size() - 1).rate();
        String rateText = MoneyFormat.percent(rate, 1);
        Category category;
        String message;
        if (rate.compareTo(SAVINGS_BENCHMARK) > 0) {
            category = Category.SUCCESS;
            message = "Your " + rateText + "% savings rate exceeds the 20% benchmark. Excellent work! Consider investing surplus savings.";
        } else if (rate.compareTo(SAVINGS_FLOOR) >= 0) {
            category = Category.INFO;
            message = "Your " + rateText + "% savings rate is decent but below the 20% target. Look for opportunities to increase savings.";
        } else {
            category = Category.WARNING;
            message = "Your " + rateText + "% savings rate is below recommended levels. Review expenses to find savings opportunities.";
        }
        boolean belowBenchmark = rate.compareTo(SAVINGS_BENCHMARK) < 0;
        insights.add(new Insight(
                "savings-rate",
                category,
                "fas fa-piggy-bank",
                rateText + "% Savings Rate",
                message,
                belowBenchmark,
                belowBenchmark ? Optional.of("Improve Savings") : Optional.empty()));

        if (points.size() >= 3) {
            BigDecimal first = points.get(points.size() - 3).savings();
            BigDecimal last = points.get(points.size() - 1).savings();
            boolean increasing = last.compareTo(first) > 0;
            insights.add(new Insight(
                    "savings-trend",
                    increasing ? Category.SUCCESS : Category.WARNING,
                    increasing ? "fas fa-arrow-trend-up" : "fas fa-arrow-trend-down",
                    increasing ? "Savings Growing" : "Savings Declining",
                    "Your savings " + (increasing ? "increased" : "decreased") + " from " + money(first) + " to " + money(last)
                            + " over 3 months. "
                            + (increasing ? "Keep up the momentum!" : "Review your budget to reverse this trend."),
                    !increasing,
                    Optional.empty()));
        }
    }

    private void trendInsights(List<TrendEntry> trends, List<Insight> insights) {
        trends.stream().filter(TrendEntry::increased).findFirst().ifPresent(up -> insights.add(new Insight(
                "biggest-increase",
                Category.WARNING,
                "fas fa-arrow-up",
                up.category() + " Spending Up",
                up.category() + " increased by " + MoneyFormat.percent(up.percentChange(), 0) + "% ("
                        + money(up.previousAmount()) + " to " + money(up.currentAmount()) + "). Review if this change is intentional.",
                true,
                Optional.of("Review Category"))));
        trends.stream().filter(TrendEntry::decreased).findFirst().ifPresent(down -> insights.add(new Insight(
                "biggest-decrease",
                Category.SUCCESS,
                "fas fa-arrow-down",
                down.category() + " Spending Down",
                down.category() + " decreased by " + MoneyFormat.percent(down.percentChange().abs(), 0) + "% ("
                        + money(down.previousAmount()) + " to " + money(down.currentAmount()) + "). Great cost control!",
                false,
                Optional.empty())));
    }

    private void goalInsights(ReportData.GoalContributionReport goals, List<Insight> insights) {
        int count = goals.contributionCount();
        if (count <= 0) {
            return;
        }
        insights.add(new Insight(
                "goal-contributions",
                Category.SUCCESS,
                "fas fa-bullseye",
                "Active Goal Progress",
                "You've made " + count + " contribution" + (count > 1 ? "s" : "") + " totaling "
                        + money(goals.contributionTotal()) + " towards your goals. Consistent contributions lead to success!",
                false,
                Optional.empty()));
    }

    private void predictionInsights(List<PeriodAggregate> projections, List<Insight> insights) {
        if (projections.isEmpty()) {
            return;
        }
        BigDecimal months = BigDecimal.valueOf(projections.size());
        BigDecimal income = projections.stream().map(PeriodAggregate::income).reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(months, 2, RoundingMode.HALF_UP);
        BigDecimal expenses = projections.stream().map(PeriodAggregate::expenses).reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(months, 2, RoundingMode.HALF_UP);
        BigDecimal projectedSavings = income.subtract(expenses);
        BigDecimal rate = income.signum() > 0
                ? projectedSavings.multiply(HUNDRED).divide(income, 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        boolean healthy = rate.compareTo(PROJECTED_RATE_TARGET) > 0;
        insights.add(new Insight(
                "future-outlook",
                healthy ? Category.SUCCESS : Category.WARNING,
                "fas fa-chart-area",
                "Financial Forecast",
                "Based on current patterns, expect " + (rate.signum() > 0 ? "a" : "no") + " savings rate of "
                        + MoneyFormat.percent(rate, 1) + "% (" + money(projectedSavings.abs()) + "/month). "
                        + (healthy ? "Your financial future looks bright!" : "Consider adjusting spending to improve outlook."),
                !healthy,
                healthy ? Optional.empty() : Optional.of("Adjust Budget")));
    }

    Optional<Insight> uncategorizedWarning(List<Transaction> transactions) {
        long categorizable = transactions.stream().filter(tx -> tx.kind().categorizable()).count();
        long uncategorized = transactions.stream().filter(Transaction::isUncategorized).count();
        if (categorizable == 0 || uncategorized == 0) {
            return Optional.empty();
        }
        double ratio = (double) uncategorized / categorizable;
        if (ratio <= uncategorizedThreshold) {
            return Optional.empty();
        }
        return Optional.of(Insight.actionable(
                "uncategorized",
                Category.WARNING,
                "Uncategorized Transactions",
                uncategorized + " transaction" + (uncategorized > 1 ? "s" : "") + " (" + Math.round(ratio * 100)
                        + "%) need categorization. This improves insights accuracy and helps track spending patterns.",
                "Categorize Now"));
    }

    static Insight tip(ReportKind kind) {
        return switch (kind) {
            case SPENDING -> Insight.of("tip", Category.TIP, "Spending Tip",
                    "Review your top 3 spending categories monthly. Small reductions in major categories create significant savings over time.");
            case INCOME_EXPENSE -> Insight.of("tip", Category.TIP, "Cash Flow Tip",
                    "Maintain at least 3 months of expenses as emergency savings. This buffer protects against income disruptions.");
            case SAVINGS -> Insight.of("tip", Category.TIP, "Savings Tip",
                    "Automate your savings by setting up automatic transfers on payday. Paying yourself first keeps savings consistent.");
            case TRENDS -> Insight.of("tip", Category.TIP, "Trend Tip",
                    "Monitor trends monthly to catch concerning patterns early. Small course corrections prevent major financial issues.");
            case GOALS -> Insight.of("tip", Category.TIP, "Goals Tip",
                    "Break large goals into smaller milestones. Celebrating progress keeps you motivated on your financial journey.");
            case PREDICTIONS -> Insight.of("tip", Category.TIP, "Planning Tip",
                    "Use predictions to plan major purchases. Knowing your future cash flow helps avoid financial stress.");
        };
    }

    private BigDecimal share(BigDecimal part, BigDecimal total) {
        return part.multiply(HUNDRED).divide(total, 4, RoundingMode.HALF_UP);
    }

    private String money(BigDecimal value) {
        return MoneyFormat.amount(symbol, value);
    }
}
