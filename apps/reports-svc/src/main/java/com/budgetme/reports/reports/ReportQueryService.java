package com.budgetme.reports.reports;

import com.budgetme.reports.analytics.AnomalyDetectionService;
import com.budgetme.reports.analytics.PeriodWindows;
import com.budgetme.reports.analytics.ReportDataService;
import com.budgetme.reports.analytics.SpendingAggregator;
import com.budgetme.reports.analytics.TrendAnalyzer;
import com.budgetme.reports.category.CategoryResolver;
import com.budgetme.reports.model.Anomaly;
import com.budgetme.reports.model.CategoryBucket;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.PeriodAggregate;
import com.budgetme.reports.model.ReportData;
import com.budgetme.reports.model.ReportKind;
import com.budgetme.reports.model.SavingsPoint;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TrendEntry;
import com.budgetme.reports.repository.TransactionStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Read-side queries over a user's transactions. Each call fetches a fresh snapshot and recomputes.
 */
@Service
public class ReportQueryService {

    private final TransactionStore transactionStore;
    private final SpendingAggregator spendingAggregator;
    private final TrendAnalyzer trendAnalyzer;
    private final AnomalyDetectionService anomalyDetectionService;
    private final ReportDataService reportDataService;
    private final CategoryResolver categoryResolver;
    private final Clock clock;

    public ReportQueryService(
            TransactionStore transactionStore,
            SpendingAggregator spendingAggregator,
            TrendAnalyzer trendAnalyzer,
            AnomalyDetectionService anomalyDetectionService,
            ReportDataService reportDataService,
            CategoryResolver categoryResolver,
            Clock clock) {
        this.transactionStore = transactionStore;
        this.spendingAggregator = spendingAggregator;
        this.trendAnalyzer = trendAnalyzer;
        this.anomalyDetectionService = anomalyDetectionService;
        this.reportDataService = reportDataService;
        this.categoryResolver = categoryResolver;
        this.clock = clock;
    }

    public List<Transaction> loadTransactions(UUID userId, Granularity granularity) {
        return transactionStore.fetchTransactions(userId, PeriodWindows.fetchRange(granularity, LocalDate.now(clock)));
    }

    public List<CategoryBucket> getSpendingBuckets(UUID userId, Granularity granularity) {
        return spendingAggregator.aggregateSpending(loadTransactions(userId, granularity), categoryResolver);
    }

    public List<PeriodAggregate> getPeriodAggregates(UUID userId, Granularity granularity) {
        return spendingAggregator.aggregatePeriods(loadTransactions(userId, granularity), granularity);
    }

    public List<SavingsPoint> getSavings(UUID userId, Granularity granularity) {
        return spendingAggregator.savingsSeries(loadTransactions(userId, granularity), granularity);
    }

    public List<TrendEntry> getTrends(UUID userId, Granularity granularity) {
        return trendAnalyzer.computeTrends(loadTransactions(userId, granularity), categoryResolver, granularity);
    }

    public List<Anomaly> getAnomalies(UUID userId, Granularity granularity) {
        return anomalyDetectionService.detectAnomalies(loadTransactions(userId, granularity));
    }

    public ReportData buildReportData(ReportKind reportKind, List<Transaction> transactions, Granularity granularity) {
        return reportDataService.build(reportKind, transactions, granularity);
    }

    ReportSnapshot aggregate(ReportKind reportKind, Granularity granularity, long version, List<Transaction> transactions) {
        return new ReportSnapshot(
                reportKind,
                granularity,
                version,
                transactions.size(),
                spendingAggregator.aggregateSpending(transactions, categoryResolver),
                spendingAggregator.aggregatePeriods(transactions, granularity),
                spendingAggregator.savingsSeries(transactions, granularity),
                trendAnalyzer.computeTrends(transactions, categoryResolver, granularity),
                reportDataService.build(reportKind, transactions, granularity),
                List.of(),
                clock.instant());
    }

    ReportSnapshot withAnomalies(ReportSnapshot aggregated, List<Transaction> transactions) {
        return new ReportSnapshot(
                aggregated.reportKind(),
                aggregated.granularity(),
                aggregated.version(),
                aggregated.transactionCount(),
                aggregated.buckets(),
                aggregated.periods(),
                aggregated.savings(),
                aggregated.trends(),
                aggregated.reportData(),
                anomalyDetectionService.detectAnomalies(transactions),
                aggregated.computedAt());
    }
}
