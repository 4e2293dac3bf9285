package com.baykanat.signoff.scheduler;

import com.baykanat.signoff.domain.exception.ComplianceRunRejectedException;
import com.baykanat.signoff.domain.model.ReportRun;
import com.baykanat.signoff.domain.service.ComplianceRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Dört raporu periyodik olarak saatin şimdisiyle yeniden hesaplar (varsayılan saatte bir). Koşu API'den
 * başlatılanlarla aynı run executor kuyruğuna girer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComplianceRecomputeScheduler {

    private final ComplianceRunService complianceRunService;

    /** Aralık application.yaml'dan; başarısız ya da reddedilen koşu bir sonraki tetikte yeniden denenir. */
    @Scheduled(
            fixedRateString = "${app.scheduler.report-refresh-rate:3600000}",
            initialDelayString = "${app.scheduler.report-refresh-initial-delay:30000}"
    )
    public void recompute() {
        try {
            ReportRun run = complianceRunService.start(null);
            log.debug("Scheduled compliance run {} queued: as_of={}", run.getId(), run.getAsOf());
        } catch (ComplianceRunRejectedException e) {
            log.warn("Scheduled compliance run skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Failed to start scheduled compliance run: {}", e.getMessage(), e);
        }
    }
}
