package com.baykanat.signoff.scheduler;

import com.baykanat.signoff.config.AppProperties;
import com.baykanat.signoff.infrastructure.persistence.InboxJdbcRepository;
import com.baykanat.signoff.infrastructure.persistence.ReportRunJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Retention süresini aşan inbox key'lerini ve eski rapor koşularını siler. Son başarılı koşu korunur. */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionCleanupScheduler {

    private final InboxJdbcRepository inboxRepository;
    private final ReportRunJdbcRepository reportRunRepository;
    private final AppProperties appProperties;

    @Scheduled(
            fixedRateString = "${app.scheduler.cleanup-rate:3600000}",
            initialDelayString = "60000"
    )
    public void cleanup() {
        cleanupInbox();
        cleanupReportRuns();
    }

    void cleanupInbox() {
        try {
            int retentionDays = appProperties.getScheduler().getInboxRetentionDays();
            int deleted = inboxRepository.deleteOlderThan(retentionDays);
            if (deleted > 0) {
                log.info("Inbox cleanup: deleted {} entries older than {} days", deleted, retentionDays);
            } else {
                log.debug("Inbox cleanup: no entries older than {} days to delete", retentionDays);
            }
        } catch (Exception e) {
            log.error("Failed to cleanup inbox entries: {}", e.getMessage(), e);
        }
    }

    void cleanupReportRuns() {
        try {
            int retentionDays = appProperties.getScheduler().getReportRunRetentionDays();
            int deleted = reportRunRepository.deleteFinishedOlderThan(retentionDays);
            if (deleted > 0) {
                log.info("Report run cleanup: deleted {} runs older than {} days", deleted, retentionDays);
            } else {
                log.debug("Report run cleanup: no runs older than {} days to delete", retentionDays);
            }
        } catch (Exception e) {
            log.error("Failed to cleanup report runs: {}", e.getMessage(), e);
        }
    }
}
