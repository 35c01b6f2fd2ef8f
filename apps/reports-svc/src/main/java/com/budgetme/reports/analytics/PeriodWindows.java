package com.budgetme.reports.analytics;

import com.budgetme.reports.model.DateRange;
import com.budgetme.reports.model.Granularity;
import java.time.LocalDate;
import java.time.YearMonth;

public final class PeriodWindows {

    static final int PREDICTION_HISTORY_MONTHS = 12;

    private PeriodWindows() {
    }

    public record Window(LocalDate start, LocalDate end) {
        public boolean contains(LocalDate date) {
            return !date.isBefore(start) && !date.isAfter(end);
        }
    }

    public static Window current(Granularity granularity, LocalDate today) {
        return new Window(periodStart(granularity, today), today);
    }

    public static Window previous(Granularity granularity, LocalDate today) {
        LocalDate currentStart = periodStart(granularity, today);
        LocalDate previousStart = switch (granularity) {
            case MONTH -> currentStart.minusMonths(1);
            case QUARTER -> currentStart.minusMonths(3);
            case YEAR -> currentStart.minusYears(1);
        };
        return new Window(previousStart, currentStart.minusDays(1));
    }

    /**
     * Everything any report for this granularity can look at; open-ended so future-dated rows stay visible.
     */
    public static DateRange fetchRange(Granularity granularity, LocalDate today) {
        LocalDate bucketStart = YearMonth.from(today).minusMonths(granularity.monthBuckets() - 1L).atDay(1);
        LocalDate predictionStart = today.minusMonths(PREDICTION_HISTORY_MONTHS);
        LocalDate previousStart = previous(granularity, today).start();
        LocalDate earliest = bucketStart;
        if (predictionStart.isBefore(earliest)) {
            earliest = predictionStart;
        }
        if (previousStart.isBefore(earliest)) {
            earliest = previousStart;
        }
        return DateRange.since(earliest);
    }

    private static LocalDate periodStart(Granularity granularity, LocalDate today) {
        return switch (granularity) {
            case MONTH -> today.withDayOfMonth(1);
            case QUARTER -> LocalDate.of(today.getYear(), ((today.getMonthValue() - 1) / 3) * 3 + 1, 1);
            case YEAR -> today.withDayOfYear(1);
        };
    }
}
