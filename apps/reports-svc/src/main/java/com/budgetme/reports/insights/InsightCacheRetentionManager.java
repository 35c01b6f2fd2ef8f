package com.budgetme.reports.insights;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class InsightCacheRetentionManager {

    private static final Logger log = LoggerFactory.getLogger(InsightCacheRetentionManager.class);

    private final InsightCacheStore store;
    private final Clock clock;

    public InsightCacheRetentionManager(InsightCacheStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Scheduled(cron = "${budgetme.insights.cleanup-cron:0 30 3 * * *}")
    public void purgeExpiredOnSchedule() {
        purgeExpired("scheduled");
    }

    public int purgeExpiredNow() {
        return purgeExpired("inline");
    }

    private int purgeExpired(String source) {
        Instant cutoff = clock.instant();
        int removed = store.deleteExpiredBefore(cutoff);
        if (removed > 0) {
            log.info("Insight cache retention ({}): {} entries expired before {} removed", source, removed, cutoff);
        } else {
            log.debug("Insight cache retention ({}): nothing expired before {}", source, cutoff);
        }
        return removed;
    }
}
