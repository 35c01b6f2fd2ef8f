package com.budgetme.reports.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record PeriodAggregate(
        String periodLabel,
        YearMonth month,
        BigDecimal income,
        BigDecimal expenses,
        BigDecimal contributions
) {
    public BigDecimal net() {
        return income.subtract(expenses);
    }
}
