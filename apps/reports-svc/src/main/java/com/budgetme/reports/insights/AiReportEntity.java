package com.budgetme.reports.insights;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "ai_reports",
        indexes = @Index(name = "ai_reports_lookup_idx", columnList = "user_id, report_type, timeframe, generated_at")
)
public class AiReportEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "report_type", nullable = false, length = 32, updatable = false)
    private String reportType;

    @Column(name = "timeframe", nullable = false, length = 16, updatable = false)
    private String timeframe;

    @Column(name = "insights", nullable = false, length = 20000, updatable = false)
    private String insights;

    @Column(name = "source", nullable = false, length = 16, updatable = false)
    private String source;

    @Column(name = "ai_model", length = 128, updatable = false)
    private String model;

    @Column(name = "generated_at", nullable = false, updatable = false)
    private Instant generatedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "revision", nullable = false, updatable = false)
    private long revision;

    @Column(name = "access_count", nullable = false)
    private int accessCount;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    protected AiReportEntity() {
    }

    public AiReportEntity(
            UUID id,
            UUID userId,
            String reportType,
            String timeframe,
            String insights,
            String source,
            String model,
            Instant generatedAt,
            Instant expiresAt,
            long revision) {
        this.id = id;
        this.userId = userId;
        this.reportType = reportType;
        this.timeframe = timeframe;
        this.insights = insights;
        this.source = source;
        this.model = model;
        this.generatedAt = generatedAt;
        this.expiresAt = expiresAt;
        this.revision = revision;
    }

    @PrePersist
    void prePersist() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (generatedAt == null) {
            generatedAt = Instant.now();
        }
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getReportType() {
        return reportType;
    }

    public String getTimeframe() {
        return timeframe;
    }

    public String getInsights() {
        return insights;
    }

    public String getSource() {
        return source;
    }

    public String getModel() {
        return model;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public long getRevision() {
        return revision;
    }

    public int getAccessCount() {
        return accessCount;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }
}
