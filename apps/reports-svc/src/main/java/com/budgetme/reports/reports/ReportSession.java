package com.budgetme.reports.reports;

import com.budgetme.reports.ai.InsightGenerationService;
import com.budgetme.reports.events.Subscription;
import com.budgetme.reports.events.TransactionChangeChannel;
import com.budgetme.reports.events.TransactionsChangedEvent;
import com.budgetme.reports.insights.InsightCache;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.ReportData;
import com.budgetme.reports.model.ReportKind;
import com.budgetme.reports.model.Transaction;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-user reactive report state. Transaction changes re-run aggregation and the anomaly scan; insight requests are
 * answered from the cache or generated on the insight executor. Every change and every forced regeneration advances
 * the version token, and a generation that finishes under an older version is discarded.
 */
public class ReportSession {

    private static final Logger log = LoggerFactory.getLogger(ReportSession.class);

    private final UUID userId;
    private final TransactionChangeChannel changeChannel;
    private final ReportQueryService queryService;
    private final InsightCache insightCache;
    private final InsightGenerationService generationService;
    private final Executor insightExecutor;

    private final AtomicLong version = new AtomicLong();
    private final Object versionLock = new Object();
    private final Map<GenerationKey, InFlight> inFlight = new ConcurrentHashMap<>();

    private volatile ReportKind reportKind;
    private volatile Granularity granularity;
    private volatile SessionState phase = SessionState.IDLE;
    private volatile ReportSnapshot snapshot;
    private volatile Subscription subscription;
    private volatile Instant lastAccessedAt;

    private record GenerationKey(ReportKind reportKind, Granularity granularity) {}

    private record InFlight(long version, CompletableFuture<InsightOutcome> future) {}

    ReportSession(
            UUID userId,
            ReportKind reportKind,
            Granularity granularity,
            TransactionChangeChannel changeChannel,
            ReportQueryService queryService,
            InsightCache insightCache,
            InsightGenerationService generationService,
            Executor insightExecutor) {
        this.userId = userId;
        this.reportKind = reportKind;
        this.granularity = granularity;
        this.changeChannel = changeChannel;
        this.queryService = queryService;
        this.insightCache = insightCache;
        this.generationService = generationService;
        this.insightExecutor = insightExecutor;
    }

    void start() {
        subscription = changeChannel.subscribe(userId, this::onTransactionsChanged);
        refresh();
    }

    void stop() {
        Subscription current = subscription;
        subscription = null;
        if (current != null) {
            current.unsubscribe();
        }
        advanceVersion();
        log.debug("Report session stopped: user={}", userId);
    }

    public UUID userId() {
        return userId;
    }

    public ReportKind reportKind() {
        return reportKind;
    }

    public Granularity granularity() {
        return granularity;
    }

    public long version() {
        return version.get();
    }

    void touch(Instant now) {
        lastAccessedAt = now;
    }

    boolean idleSince(Instant cutoff) {
        Instant accessed = lastAccessedAt;
        return inFlight.isEmpty() && accessed != null && accessed.isBefore(cutoff);
    }

    public Optional<ReportSnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    public SessionState state() {
        SessionState current = phase;
        if (current != SessionState.IDLE) {
            return current;
        }
        return inFlight.isEmpty() ? SessionState.IDLE : SessionState.INSIGHT_FETCHING;
    }

    public void select(ReportKind newReportKind, Granularity newGranularity) {
        this.reportKind = newReportKind;
        this.granularity = newGranularity;
        refresh();
    }

    void onTransactionsChanged(TransactionsChangedEvent event) {
        long current = advanceVersion();
        log.debug("Report session: transactions changed ({}) for user={}, version={}", event.changeType(), userId, current);
        refresh();
    }

    /**
     * Recomputes the snapshot for the current selection. Overlapping refreshes are serialized; the last one wins.
     */
    synchronized void refresh() {
        ReportKind kind = reportKind;
        Granularity gran = granularity;
        long atVersion = version.get();
        try {
            phase = SessionState.AGGREGATING;
            List<Transaction> transactions = queryService.loadTransactions(userId, gran);
            ReportSnapshot aggregated = queryService.aggregate(kind, gran, atVersion, transactions);
            phase = SessionState.ANOMALY_SCANNING;
            snapshot = queryService.withAnomalies(aggregated, transactions);
        } catch (RuntimeException ex) {
            log.warn("Report session: refresh failed for user={}, keeping previous snapshot", userId, ex);
        } finally {
            phase = SessionState.IDLE;
        }
    }

    /**
     * Cached insights when a live entry exists (unless {@code regenerate}), otherwise a shared in-flight generation.
     */
    public CompletableFuture<InsightOutcome> requestInsights(ReportKind kind, Granularity gran, boolean regenerate) {
        GenerationKey key = new GenerationKey(kind, gran);
        synchronized (versionLock) {
            long atVersion = regenerate ? version.incrementAndGet() : version.get();
            InFlight running = inFlight.get(key);
            if (running != null && running.version() == atVersion) {
                log.debug("Insight request joined in-flight generation: user={} report={} version={}", userId, kind.code(), atVersion);
                return running.future();
            }
            if (!regenerate) {
                Optional<InsightCacheEntry> cached = lookupCache(kind, gran);
                if (cached.isPresent()) {
                    return CompletableFuture.completedFuture(InsightOutcome.cached(cached.get()));
                }
            }
            return startGeneration(key, atVersion);
        }
    }

    private Optional<InsightCacheEntry> lookupCache(ReportKind kind, Granularity gran) {
        try {
            return insightCache.lookup(userId, kind, gran);
        } catch (RuntimeException ex) {
            log.warn("Insight cache lookup failed for user={} report={}, generating instead", userId, kind.code(), ex);
            return Optional.empty();
        }
    }

    private CompletableFuture<InsightOutcome> startGeneration(GenerationKey key, long atVersion) {
        CompletableFuture<InsightOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(() -> generate(key, atVersion), insightExecutor);
        } catch (RejectedExecutionException ex) {
            log.warn("Insight generation rejected for user={} report={}: {}", userId, key.reportKind().code(), ex.getMessage());
            return CompletableFuture.completedFuture(InsightOutcome.unavailable());
        }
        InFlight running = new InFlight(atVersion, future);
        inFlight.put(key, running);
        future.whenComplete((outcome, error) -> inFlight.remove(key, running));
        return future;
    }

    private InsightOutcome generate(GenerationKey key, long atVersion) {
        try {
            List<Transaction> transactions = queryService.loadTransactions(userId, key.granularity());
            ReportData reportData = queryService.buildReportData(key.reportKind(), transactions, key.granularity());
            InsightGenerationService.GeneratedInsights generated = generationService.generateInsights(reportData, transactions);
            synchronized (versionLock) {
                if (version.get() != atVersion) {
                    log.debug("Discarding stale insights: user={} report={} startedAt={} current={}",
                            userId, key.reportKind().code(), atVersion, version.get());
                    return InsightOutcome.superseded();
                }
                InsightCacheEntry entry = insightCache.store(
                        userId, key.reportKind(), key.granularity(),
                        generated.insights(), generated.source(), generated.model());
                return InsightOutcome.generated(entry);
            }
        } catch (RuntimeException ex) {
            log.warn("Insight generation failed for user={} report={}", userId, key.reportKind().code(), ex);
            return InsightOutcome.unavailable();
        }
    }

    private long advanceVersion() {
        synchronized (versionLock) {
            return version.incrementAndGet();
        }
    }
}
