package com.budgetme.reports.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public final class ReportResponseDto {

    private ReportResponseDto() {
    }

    public record SpendingResponse(String granularity, BigDecimal total, List<BucketDto> buckets, String traceId) {
    }

    public record BucketDto(String category, BigDecimal amount, String color) {
    }

    public record PeriodsResponse(String granularity, List<PeriodDto> periods, String traceId) {
    }

    public record PeriodDto(
            String label,
            String month,
            BigDecimal income,
            BigDecimal expenses,
            BigDecimal contributions,
            BigDecimal net,
            BigDecimal savingsRate) {
    }

    public record SavingsResponse(String granularity, List<SavingsPointDto> points, String traceId) {
    }

    public record SavingsPointDto(String label, BigDecimal income, BigDecimal expenses, BigDecimal savings, BigDecimal rate) {
    }

    public record TrendsResponse(String granularity, List<TrendDto> trends, String traceId) {
    }

    public record TrendDto(String category, BigDecimal previousAmount, BigDecimal currentAmount, BigDecimal percentChange) {
    }

    public record AnomaliesResponse(String granularity, List<AnomalyDto> anomalies, String traceId) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AnomalyDto(
            String id,
            String kind,
            String severity,
            List<String> transactionIds,
            String title,
            String message,
            String suggestion) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InsightsResponse(
            String reportKind,
            String granularity,
            String status,
            String source,
            String model,
            Instant generatedAt,
            Instant expiresAt,
            List<InsightDto> insights,
            String traceId) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InsightDto(
            String id,
            String type,
            String icon,
            String title,
            String description,
            boolean actionable,
            String actionText) {
    }

    public record SessionResponse(
            String reportKind,
            String granularity,
            String state,
            long version,
            Integer transactionCount,
            Integer anomalyCount,
            Instant computedAt) {
    }
}
