package com.budgetme.reports.model;

import java.math.BigDecimal;

public record TrendEntry(
        String category,
        BigDecimal previousAmount,
        BigDecimal currentAmount,
        BigDecimal percentChange
) {
    public boolean increased() {
        return percentChange.signum() > 0;
    }

    public boolean decreased() {
        return percentChange.signum() < 0;
    }
}
