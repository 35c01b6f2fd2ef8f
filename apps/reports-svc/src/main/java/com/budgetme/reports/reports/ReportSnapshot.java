package com.budgetme.reports.reports;

import com.budgetme.reports.model.Anomaly;
import com.budgetme.reports.model.CategoryBucket;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.PeriodAggregate;
import com.budgetme.reports.model.ReportData;
import com.budgetme.reports.model.ReportKind;
import com.budgetme.reports.model.SavingsPoint;
import com.budgetme.reports.model.TrendEntry;
import java.time.Instant;
import java.util.List;

public record ReportSnapshot(
        ReportKind reportKind,
        Granularity granularity,
        long version,
        int transactionCount,
        List<CategoryBucket> buckets,
        List<PeriodAggregate> periods,
        List<SavingsPoint> savings,
        List<TrendEntry> trends,
        ReportData reportData,
        List<Anomaly> anomalies,
        Instant computedAt
) {
    public ReportSnapshot {
        buckets = List.copyOf(buckets);
        periods = List.copyOf(periods);
        savings = List.copyOf(savings);
        trends = List.copyOf(trends);
        anomalies = List.copyOf(anomalies);
    }
}
