package com.budgetme.reports.model;

import java.math.BigDecimal;
import java.util.List;

public sealed interface ReportData permits
        ReportData.SpendingReport,
        ReportData.IncomeExpenseReport,
        ReportData.SavingsReport,
        ReportData.TrendReport,
        ReportData.GoalContributionReport,
        ReportData.PredictionReport {

    ReportKind kind();

    record SpendingReport(List<CategoryBucket> buckets) implements ReportData {
        public SpendingReport {
            buckets = List.copyOf(buckets);
        }

        @Override
        public ReportKind kind() {
            return ReportKind.SPENDING;
        }
    }

    record IncomeExpenseReport(List<PeriodAggregate> periods) implements ReportData {
        public IncomeExpenseReport {
            periods = List.copyOf(periods);
        }

        @Override
        public ReportKind kind() {
            return ReportKind.INCOME_EXPENSE;
        }
    }

    record SavingsReport(List<SavingsPoint> points) implements ReportData {
        public SavingsReport {
            points = List.copyOf(points);
        }

        @Override
        public ReportKind kind() {
            return ReportKind.SAVINGS;
        }
    }

    record TrendReport(List<TrendEntry> trends) implements ReportData {
        public TrendReport {
            trends = List.copyOf(trends);
        }

        @Override
        public ReportKind kind() {
            return ReportKind.TRENDS;
        }
    }

    record GoalContributionReport(int contributionCount, BigDecimal contributionTotal) implements ReportData {
        @Override
        public ReportKind kind() {
            return ReportKind.GOALS;
        }
    }

    record PredictionReport(List<PeriodAggregate> projections) implements ReportData {
        public PredictionReport {
            projections = List.copyOf(projections);
        }

        @Override
        public ReportKind kind() {
            return ReportKind.PREDICTIONS;
        }
    }
}
