package com.budgetme.reports.insights;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AiReportRepository extends JpaRepository<AiReportEntity, UUID> {

    // Rows generated at the same instant resolve to the one inserted last.
    Optional<AiReportEntity> findFirstByUserIdAndReportTypeAndTimeframeAndExpiresAtAfterOrderByGeneratedAtDescRevisionDesc(
            UUID userId, String reportType, String timeframe, Instant now);

    @Query("select coalesce(max(r.revision), 0) from AiReportEntity r "
            + "where r.userId = :userId and r.reportType = :reportType and r.timeframe = :timeframe")
    long findMaxRevision(
            @Param("userId") UUID userId, @Param("reportType") String reportType, @Param("timeframe") String timeframe);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update AiReportEntity r set r.accessCount = r.accessCount + 1, r.lastAccessedAt = :accessedAt where r.id = :id")
    int incrementAccess(@Param("id") UUID id, @Param("accessedAt") Instant accessedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from AiReportEntity r where r.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
