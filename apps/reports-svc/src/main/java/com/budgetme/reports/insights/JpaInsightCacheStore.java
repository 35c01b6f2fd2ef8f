package com.budgetme.reports.insights;

import com.budgetme.reports.model.Granularity;
import com.budgetme.reports.model.Insight;
import com.budgetme.reports.model.InsightCacheEntry;
import com.budgetme.reports.model.ReportKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@ConditionalOnProperty(prefix = "budgetme.insights", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaInsightCacheStore implements InsightCacheStore {

    private static final Logger log = LoggerFactory.getLogger(JpaInsightCacheStore.class);
    private static final TypeReference<List<StoredInsight>> STORED_INSIGHTS = new TypeReference<>() {};

    private final AiReportRepository repository;
    private final ObjectMapper objectMapper;

    public JpaInsightCacheStore(AiReportRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    record StoredInsight(
            String id,
            String type,
            String icon,
            String title,
            String description,
            boolean actionable,
            String actionText) {

        static StoredInsight from(Insight insight) {
            return new StoredInsight(
                    insight.id(),
                    insight.category().name().toLowerCase(Locale.ROOT),
                    insight.icon(),
                    insight.title(),
                    insight.description(),
                    insight.actionable(),
                    insight.actionText().orElse(null));
        }

        Optional<Insight> toInsight() {
            return Insight.Category.fromCode(type).map(category -> new Insight(
                    id, category, icon, title, description, actionable, Optional.ofNullable(actionText)));
        }
    }

    @Override
    @Transactional
    public InsightCacheEntry insert(InsightCacheEntry entry) {
        String reportType = entry.reportKind().code();
        String timeframe = timeframe(entry.granularity());
        long revision = repository.findMaxRevision(entry.userId(), reportType, timeframe) + 1;
        AiReportEntity entity = new AiReportEntity(
                entry.id(),
                entry.userId(),
                reportType,
                timeframe,
                writeInsights(entry.insights()),
                entry.source().name(),
                entry.model(),
                entry.generatedAt(),
                entry.expiresAt(),
                revision);
        repository.save(entity);
        return entry;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<InsightCacheEntry> queryLatestUnexpired(UUID userId, ReportKind reportKind, Granularity granularity, Instant now) {
        return repository.findFirstByUserIdAndReportTypeAndTimeframeAndExpiresAtAfterOrderByGeneratedAtDescRevisionDesc(
                        userId, reportKind.code(), timeframe(granularity), now)
                .map(entity -> toEntry(entity, reportKind, granularity));
    }

    @Override
    @Transactional
    public void incrementAccess(UUID entryId, Instant accessedAt) {
        repository.incrementAccess(entryId, accessedAt);
    }

    @Override
    @Transactional
    public int deleteExpiredBefore(Instant cutoff) {
        return repository.deleteExpiredBefore(cutoff);
    }

    private InsightCacheEntry toEntry(AiReportEntity entity, ReportKind reportKind, Granularity granularity) {
        return new InsightCacheEntry(
                entity.getId(),
                entity.getUserId(),
                reportKind,
                granularity,
                readInsights(entity),
                InsightCacheEntry.Source.valueOf(entity.getSource()),
                entity.getModel(),
                entity.getGeneratedAt(),
                entity.getExpiresAt(),
                entity.getAccessCount(),
                entity.getLastAccessedAt());
    }

    private String writeInsights(List<Insight> insights) {
        try {
            return objectMapper.writeValueAsString(insights.stream().map(StoredInsight::from).toList());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize insights", ex);
        }
    }

    private List<Insight> readInsights(AiReportEntity entity) {
        try {
            return objectMapper.readValue(entity.getInsights(), STORED_INSIGHTS).stream()
                    .map(StoredInsight::toInsight)
                    .flatMap(Optional::stream)
                    .toList();
        } catch (JsonProcessingException ex) {
            log.warn("Insight cache: unreadable insights in row {}, treating as empty", entity.getId(), ex);
            return List.of();
        }
    }

    static String timeframe(Granularity granularity) {
        return granularity.name().toLowerCase(Locale.ROOT);
    }
}
