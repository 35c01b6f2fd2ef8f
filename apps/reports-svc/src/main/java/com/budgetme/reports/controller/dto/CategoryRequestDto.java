package com.budgetme.reports.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CategoryRequestDto(@NotBlank @Size(max = 64) String name) {
}
