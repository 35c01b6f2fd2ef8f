package com.budgetme.reports.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public record Transaction(
        UUID id,
        UUID userId,
        BigDecimal amount,
        LocalDate date,
        TransactionKind kind,
        Optional<String> categoryId,
        Optional<UUID> accountId,
        Optional<String> description
) {
    public Transaction {
        if (id == null) {
            throw new IllegalArgumentException("id must be provided");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount must be provided");
        }
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must be provided");
        }
        categoryId = categoryId == null ? Optional.empty() : categoryId.filter(value -> !value.isBlank());
        accountId = accountId == null ? Optional.empty() : accountId;
        description = description == null ? Optional.empty() : description;
    }

    public boolean isUncategorized() {
        return kind.categorizable() && categoryId.isEmpty();
    }

    public Transaction withCategory(String newCategoryId) {
        return new Transaction(id, userId, amount, date, kind, Optional.ofNullable(newCategoryId), accountId, description);
    }
}
