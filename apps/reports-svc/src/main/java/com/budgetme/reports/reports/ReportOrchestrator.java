package com.budgetme.reports.reports;

import com.budgetme.reports.ai.InsightGenerationService;
import com.budgetme.reports.config.BudgetmeProperties;
import com.budgetme.reports.events.TransactionChangeChannel;
import com.budgetme.reports.insights.InsightCache;
import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.ReportKind;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Owns one {@link ReportSession} per user and routes insight requests through it. Sessions left untouched for the
 * configured idle timeout are stopped by a periodic sweep.
 */
@Service
public class ReportOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReportOrchestrator.class);

    private final TransactionChangeChannel changeChannel;
    private final ReportQueryService queryService;
    private final InsightCache insightCache;
    private final InsightGenerationService generationService;
    private final Executor insightExecutor;
    private final Clock clock;
    private final Duration idleTimeout;
    private final Map<UUID, ReportSession> sessions = new ConcurrentHashMap<>();

    public ReportOrchestrator(
            TransactionChangeChannel changeChannel,
            ReportQueryService queryService,
            InsightCache insightCache,
            InsightGenerationService generationService,
            @Qualifier("insightTaskExecutor") Executor insightExecutor,
            BudgetmeProperties properties,
            Clock clock) {
        this.changeChannel = changeChannel;
        this.queryService = queryService;
        this.insightCache = insightCache;
        this.generationService = generationService;
        this.insightExecutor = insightExecutor;
        this.clock = clock;
        this.idleTimeout = Duration.ofMinutes(properties.sessions().idleTimeoutMinutes());
    }

    /**
     * Starts a session for the user, or switches the selection of the running one.
     */
    public ReportSession open(UUID userId, ReportKind reportKind, Granularity granularity) {
        ReportSession session = acquire(userId, reportKind, granularity);
        if (session.reportKind() != reportKind || session.granularity() != granularity) {
            session.select(reportKind, granularity);
        }
        return session;
    }

    private ReportSession acquire(UUID userId, ReportKind reportKind, Granularity granularity) {
        Instant now = clock.instant();
        return sessions.compute(userId, (id, existing) -> {
            if (existing != null) {
                existing.touch(now);
                return existing;
            }
            ReportSession created = new ReportSession(
                    id, reportKind, granularity, changeChannel, queryService, insightCache, generationService, insightExecutor);
            created.touch(now);
            created.start();
            log.debug("Report session opened: user={} report={} granularity={}", id, reportKind.code(), granularity);
            return created;
        });
    }

    public boolean close(UUID userId) {
        ReportSession session = sessions.remove(userId);
        if (session == null) {
            return false;
        }
        session.stop();
        return true;
    }

    public Optional<ReportSession> session(UUID userId) {
        Instant now = clock.instant();
        return Optional.ofNullable(sessions.computeIfPresent(userId, (id, existing) -> {
            existing.touch(now);
            return existing;
        }));
    }

    public CompletableFuture<InsightOutcome> getOrGenerateInsights(
            UUID userId,
            ReportKind reportKind,
            Granularity granularity,
            boolean regenerate) {
        return acquire(userId, reportKind, granularity).requestInsights(reportKind, granularity, regenerate);
    }

    @Scheduled(fixedDelayString = "${budgetme.sessions.sweep-interval-ms:60000}")
    public void evictIdleSessionsOnSchedule() {
        evictIdleSessions();
    }

    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (UUID userId : sessions.keySet()) {
            ReportSession[] removed = new ReportSession[1];
            sessions.computeIfPresent(userId, (id, session) -> {
                if (!session.idleSince(cutoff)) {
                    return session;
                }
                removed[0] = session;
                return null;
            });
            if (removed[0] != null) {
                removed[0].stop();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle report session(s) not accessed since {}", evicted, cutoff);
        }
        return evicted;
    }

    int sessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        if (!sessions.isEmpty()) {
            log.info("Stopping {} report session(s)", sessions.size());
        }
        sessions.keySet().forEach(this::close);
    }
}
