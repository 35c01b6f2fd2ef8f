package com.budgetme.reports.analytics;

import com.budgetme.reports.category.CategoryResolver;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.ReportData;
import com.budgetme.reports.model.ReportKind;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TransactionKind;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class ReportDataService {

    private final SpendingAggregator spendingAggregator;
    private final TrendAnalyzer trendAnalyzer;
    private final CategoryResolver categoryResolver;
    private final Clock clock;

    public ReportDataService(
            SpendingAggregator spendingAggregator,
            TrendAnalyzer trendAnalyzer,
            CategoryResolver categoryResolver,
            Clock clock) {
        this.spendingAggregator = spendingAggregator;
        this.trendAnalyzer = trendAnalyzer;
        this.categoryResolver = categoryResolver;
        this.clock = clock;
    }

    public ReportData build(ReportKind reportKind, List<Transaction> transactions, Granularity granularity) {
        return switch (reportKind) {
            case SPENDING -> new ReportData.SpendingReport(
                    spendingAggregator.aggregateSpending(transactions, categoryResolver));
            case INCOME_EXPENSE -> new ReportData.IncomeExpenseReport(
                    spendingAggregator.aggregatePeriods(transactions, granularity));
            case SAVINGS -> new ReportData.SavingsReport(
                    spendingAggregator.savingsSeries(transactions, granularity));
            case TRENDS -> new ReportData.TrendReport(
                    trendAnalyzer.computeTrends(transactions, categoryResolver, granularity));
            case GOALS -> goalContributions(transactions);
            case PREDICTIONS -> new ReportData.PredictionReport(
                    spendingAggregator.projectPeriods(transactions, LocalDate.now(clock)));
        };
    }

    private ReportData.GoalContributionReport goalContributions(List<Transaction> transactions) {
        List<Transaction> contributions = transactions.stream()
                .filter(tx -> tx.kind() == TransactionKind.CONTRIBUTION)
                .toList();
        BigDecimal total = contributions.stream()
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new ReportData.GoalContributionReport(contributions.size(), total);
    }
}
