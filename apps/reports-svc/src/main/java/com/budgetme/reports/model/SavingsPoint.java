package com.budgetme.reports.model;

import java.math.BigDecimal;

public record SavingsPoint(
        String periodLabel,
        BigDecimal income,
        BigDecimal expenses,
        BigDecimal savings,
        BigDecimal rate
) {
}
