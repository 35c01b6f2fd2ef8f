package com.budgetme.reports.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record TransactionRequestDto(
        UUID id,
        @NotNull BigDecimal amount,
        @NotNull LocalDate date,
        @NotBlank String type,
        @Size(max = 64) String categoryId,
        UUID accountId,
        @Size(max = 255) String description
) {
}
