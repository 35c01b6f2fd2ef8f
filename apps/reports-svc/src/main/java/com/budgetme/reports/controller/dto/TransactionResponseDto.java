package com.budgetme.reports.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionResponseDto(
        String id,
        String userId,
        BigDecimal amount,
        LocalDate date,
        String type,
        String categoryId,
        String accountId,
        String description
) {
}
