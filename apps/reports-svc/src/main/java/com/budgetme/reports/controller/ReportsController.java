package com.budgetme.reports.controller;

import com.budgetme.reports.analytics.SpendingAggregator;
import com.budgetme.reports.controller.dto.ReportResponseDto;
import com.budgetme.reports.model.Anomaly;
import com.budgetme.reports.model.CategoryBucket;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.PeriodAggregate;
import com.budgetme.reports.model.ReportKind;
import com.budgetme.reports.reports.InsightOutcome;
import com.budgetme.reports.reports.ReportOrchestrator;
import com.budgetme.reports.reports.ReportQueryService;
import com.budgetme.reports.reports.ReportSession;
import com.budgetme.reports.reports.ReportSnapshot;
import com.budgetme.reports.security.RequestContextHolder;
import com.budgetme.reports.security.TraceIdFilter;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reports")
public class ReportsController {

    private final ReportQueryService queryService;
    private final ReportOrchestrator orchestrator;
    private final SpendingAggregator spendingAggregator;

    public ReportsController(ReportQueryService queryService, ReportOrchestrator orchestrator, SpendingAggregator spendingAggregator) {
        this.queryService = queryService;
        this.orchestrator = orchestrator;
        this.spendingAggregator = spendingAggregator;
    }

    @GetMapping("/spending")
    public ResponseEntity<ReportResponseDto.SpendingResponse> spending(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @RequestParam(value = "granularity", required = false) String granularity
    ) {
        Granularity gran = Granularity.parse(granularity);
        List<CategoryBucket> buckets = queryService.getSpendingBuckets(userId, gran);
        BigDecimal total = buckets.stream().map(CategoryBucket::totalAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        return ResponseEntity.ok(new ReportResponseDto.SpendingResponse(
                code(gran),
                total,
                buckets.stream()
                        .map(bucket -> new ReportResponseDto.BucketDto(bucket.categoryName(), bucket.totalAmount(), bucket.color()))
                        .toList(),
                traceId()));
    }

    @GetMapping("/periods")
    public ResponseEntity<ReportResponseDto.PeriodsResponse> periods(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @RequestParam(value = "granularity", required = false) String granularity
    ) {
        Granularity gran = Granularity.parse(granularity);
        List<PeriodAggregate> periods = queryService.getPeriodAggregates(userId, gran);
        return ResponseEntity.ok(new ReportResponseDto.PeriodsResponse(
                code(gran),
                periods.stream().map(this::toPeriodDto).toList(),
                traceId()));
    }

    @GetMapping("/savings")
    public ResponseEntity<ReportResponseDto.SavingsResponse> savings(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @RequestParam(value = "granularity", required = false) String granularity
    ) {
        Granularity gran = Granularity.parse(granularity);
        return ResponseEntity.ok(new ReportResponseDto.SavingsResponse(
                code(gran),
                queryService.getSavings(userId, gran).stream()
                        .map(point -> new ReportResponseDto.SavingsPointDto(
                                point.periodLabel(), point.income(), point.expenses(), point.savings(), point.rate()))
                        .toList(),
                traceId()));
    }

    @GetMapping("/trends")
    public ResponseEntity<ReportResponseDto.TrendsResponse> trends(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @RequestParam(value = "granularity", required = false) String granularity
    ) {
        Granularity gran = Granularity.parse(granularity);
        return ResponseEntity.ok(new ReportResponseDto.TrendsResponse(
                code(gran),
                queryService.getTrends(userId, gran).stream()
                        .map(trend -> new ReportResponseDto.TrendDto(
                                trend.category(), trend.previousAmount(), trend.currentAmount(), trend.percentChange()))
                        .toList(),
                traceId()));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<ReportResponseDto.AnomaliesResponse> anomalies(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @RequestParam(value = "granularity", required = false) String granularity
    ) {
        Granularity gran = Granularity.parse(granularity);
        return ResponseEntity.ok(new ReportResponseDto.AnomaliesResponse(
                code(gran),
                queryService.getAnomalies(userId, gran).stream().map(ReportsController::toAnomalyDto).toList(),
                traceId()));
    }

    @PostMapping("/insights")
    public CompletableFuture<ResponseEntity<ReportResponseDto.InsightsResponse>> insights(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @RequestParam("reportKind") String reportKind,
            @RequestParam(value = "granularity", required = false) String granularity,
            @RequestParam(value = "regenerate", required = false, defaultValue = "false") boolean regenerate
    ) {
        ReportKind kind = ReportKind.parse(reportKind);
        Granularity gran = Granularity.parse(granularity);
        String traceId = traceId();
        return orchestrator.getOrGenerateInsights(userId, kind, gran, regenerate)
                .thenApply(outcome -> ResponseEntity.ok(toInsightsResponse(kind, gran, outcome, traceId)));
    }

    @PostMapping("/session")
    public ResponseEntity<ReportResponseDto.SessionResponse> openSession(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @RequestParam("reportKind") String reportKind,
            @RequestParam(value = "granularity", required = false) String granularity
    ) {
        ReportSession session = orchestrator.open(userId, ReportKind.parse(reportKind), Granularity.parse(granularity));
        return ResponseEntity.ok(toSessionResponse(session));
    }

    @GetMapping("/session")
    public ResponseEntity<ReportResponseDto.SessionResponse> session(@RequestHeader(TraceIdFilter.USER_HEADER) UUID userId) {
        return orchestrator.session(userId)
                .map(session -> ResponseEntity.ok(toSessionResponse(session)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/session")
    public ResponseEntity<Void> closeSession(@RequestHeader(TraceIdFilter.USER_HEADER) UUID userId) {
        return orchestrator.close(userId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private ReportResponseDto.PeriodDto toPeriodDto(PeriodAggregate period) {
        return new ReportResponseDto.PeriodDto(
                period.periodLabel(),
                period.month().toString(),
                period.income(),
                period.expenses(),
                period.contributions(),
                period.net(),
                spendingAggregator.computeSavingsRate(period));
    }

    private static ReportResponseDto.AnomalyDto toAnomalyDto(Anomaly anomaly) {
        return new ReportResponseDto.AnomalyDto(
                anomaly.id(),
                anomaly.kind().name(),
                anomaly.severity().name(),
                anomaly.affectedTransactionIds().stream().map(UUID::toString).toList(),
                anomaly.title(),
                anomaly.message(),
                anomaly.suggestion().orElse(null));
    }

    private static ReportResponseDto.InsightsResponse toInsightsResponse(
            ReportKind kind, Granularity gran, InsightOutcome outcome, String traceId) {
        Optional<InsightCacheEntry> entry = outcome.entry();
        return new ReportResponseDto.InsightsResponse(
                kind.code(),
                code(gran),
                outcome.status().name(),
                entry.map(e -> e.source().name()).orElse(null),
                entry.map(InsightCacheEntry::model).orElse(null),
                entry.map(InsightCacheEntry::generatedAt).orElse(null),
                entry.map(InsightCacheEntry::expiresAt).orElse(null),
                outcome.insights().stream().map(ReportsController::toInsightDto).toList(),
                traceId);
    }

    private static ReportResponseDto.InsightDto toInsightDto(Insight insight) {
        return new ReportResponseDto.InsightDto(
                insight.id(),
                insight.category().name().toLowerCase(Locale.ROOT),
                insight.icon(),
                insight.title(),
                insight.description(),
                insight.actionable(),
                insight.actionText().orElse(null));
    }

    private static ReportResponseDto.SessionResponse toSessionResponse(ReportSession session) {
        Optional<ReportSnapshot> snapshot = session.snapshot();
        return new ReportResponseDto.SessionResponse(
                session.reportKind().code(),
                code(session.granularity()),
                session.state().name(),
                session.version(),
                snapshot.map(ReportSnapshot::transactionCount).orElse(null),
                snapshot.map(s -> s.anomalies().size()).orElse(null),
                snapshot.map(ReportSnapshot::computedAt).orElse(null));
    }

    private static String code(Granularity granularity) {
        return granularity.name().toLowerCase(Locale.ROOT);
    }

    private static String traceId() {
        return RequestContextHolder.traceId().orElse(null);
    }
}
