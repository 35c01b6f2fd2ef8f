package com.budgetme.reports.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public record Anomaly(
        String id,
        Kind kind,
        Severity severity,
        Set<UUID> affectedTransactionIds,
        String title,
        String message,
        Optional<String> suggestion
) {
    public Anomaly {
        affectedTransactionIds = affectedTransactionIds == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(affectedTransactionIds));
        suggestion = suggestion == null ? Optional.empty() : suggestion;
    }

    public enum Kind {
        STATISTICAL_SPIKE("spike"),
        DUPLICATE("duplicate"),
        UNCATEGORIZED_PATTERN("uncategorized"),
        FREQUENCY_OUTLIER("frequency"),
        DATA_ERROR("error");

        private final String idPrefix;

        Kind(String idPrefix) {
            this.idPrefix = idPrefix;
        }

        public String idPrefix() {
            return idPrefix;
        }
    }

    /**
     * Declaration order is the ranking order of a detection run.
     */
    public enum Severity {
        ERROR,
        HIGH,
        MEDIUM,
        LOW
    }
}
