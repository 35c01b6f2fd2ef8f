package com.budgetme.reports.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.budgetme.reports.model.DateRange;
import com.budgetme.reports.model.Granularity;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class PeriodWindowsTest {

    private final LocalDate today = LocalDate.of(2025, 5, 20);

    @Test
    void currentAndPreviousWindowsPerGranularity() {
        assertThat(PeriodWindows.current(Granularity.MONTH, today).start()).isEqualTo(LocalDate.of(2025, 5, 1));
        assertThat(PeriodWindows.previous(Granularity.MONTH, today))
                .isEqualTo(new PeriodWindows.Window(LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 30)));
        assertThat(PeriodWindows.previous(Granularity.QUARTER, today))
                .isEqualTo(new PeriodWindows.Window(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 3, 31)));
        assertThat(PeriodWindows.previous(Granularity.YEAR, today))
                .isEqualTo(new PeriodWindows.Window(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)));
    }

    @Test
    void fetchRangeCoversPredictionHistoryAndStaysOpenEnded() {
        DateRange monthly = PeriodWindows.fetchRange(Granularity.MONTH, today);
        DateRange yearly = PeriodWindows.fetchRange(Granularity.YEAR, today);

        assertThat(monthly.from()).contains(LocalDate.of(2024, 5, 20));
        assertThat(monthly.to()).isEmpty();
        assertThat(monthly.contains(LocalDate.of(2026, 1, 1))).isTrue();
        assertThat(yearly.from()).contains(LocalDate.of(2022, 6, 1));
    }
}
