package com.budgetme.reports.reports;

import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.InsightCacheEntry;
import java.util.List;
import java.util.Optional;

/**
 * Result of an insight request. Only {@link Status#CACHED} and {@link Status#GENERATED} carry insights.
 */
public record InsightOutcome(Status status, List<Insight> insights, Optional<InsightCacheEntry> entry) {

    public InsightOutcome {
        insights = insights == null ? List.of() : List.copyOf(insights);
        entry = entry == null ? Optional.empty() : entry;
    }

    public enum Status {
        CACHED,
        GENERATED,
        SUPERSEDED,
        UNAVAILABLE
    }

    public static InsightOutcome cached(InsightCacheEntry entry) {
        return new InsightOutcome(Status.CACHED, entry.insights(), Optional.of(entry));
    }

    public static InsightOutcome generated(InsightCacheEntry entry) {
        return new InsightOutcome(Status.GENERATED, entry.insights(), Optional.of(entry));
    }

    public static InsightOutcome superseded() {
        return new InsightOutcome(Status.SUPERSEDED, List.of(), Optional.empty());
    }

    public static InsightOutcome unavailable() {
        return new InsightOutcome(Status.UNAVAILABLE, List.of(), Optional.empty());
    }
}
