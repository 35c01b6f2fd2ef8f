package com.budgetme.reports.model;

import java.math.BigDecimal;

public record CategoryBucket(String categoryName, BigDecimal totalAmount, String color) {
}
