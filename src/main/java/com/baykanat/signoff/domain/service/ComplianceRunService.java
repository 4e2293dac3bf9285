package com.baykanat.signoff.domain.service;

import com.baykanat.signoff.domain.engine.ComplianceEngine;
import com.baykanat.signoff.domain.engine.ComplianceReport;
import com.baykanat.signoff.domain.exception.ComplianceRunRejectedException;
import com.baykanat.signoff.domain.exception.ReportRunNotFoundException;
import com.baykanat.signoff.domain.model.ComplianceSnapshot;
import com.baykanat.signoff.domain.model.ReportRun;
import com.baykanat.signoff.infrastructure.metrics.ComplianceMetrics;
import com.baykanat.signoff.infrastructure.persistence.ReportResultJdbcRepository;
import com.baykanat.signoff.infrastructure.persistence.ReportRunJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Rapor koşusu: as-of'u sabitler, snapshot'ı bir kez okur, dört raporu hesaplar ve sonucu
 * run_id altında atomik olarak yazar. Hata olursa koşu FAILED işaretlenir, önceki sonuçlar etkilenmez.
 */
@Slf4j
@Service
public class ComplianceRunService {

    private static final int REJECTED_RETRY_AFTER_SECONDS = 60;

    private final ComplianceSnapshotLoader snapshotLoader;
    private final ComplianceEngine complianceEngine;
    private final ReportRunJdbcRepository reportRunRepository;
    private final ReportResultJdbcRepository reportResultRepository;
    private final TransactionTemplate transactionTemplate;
    private final ComplianceMetrics metrics;
    private final Clock clock;
    private final TaskExecutor runExecutor;

    public ComplianceRunService(ComplianceSnapshotLoader snapshotLoader,
                                ComplianceEngine complianceEngine,
                                ReportRunJdbcRepository reportRunRepository,
                                ReportResultJdbcRepository reportResultRepository,
                                TransactionTemplate transactionTemplate,
                                ComplianceMetrics metrics,
                                Clock clock,
                                @Qualifier("complianceRunExecutor") TaskExecutor runExecutor) {
        this.snapshotLoader = snapshotLoader;
        this.complianceEngine = complianceEngine;
        this.reportRunRepository = reportRunRepository;
        this.reportResultRepository = reportResultRepository;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
        this.runExecutor = runExecutor;
    }

    /** Saatten okunan şimdi ile senkron koşu. */
    public ReportRun runNow() {
        return runAt(LocalDateTime.now(clock));
    }

    /**
     * Verilen as-of ile senkron koşu; FAILED dahil son durumu döner. Koşu yine run executor'ında çalışır,
     * çağıran yalnızca bitmesini bekler.
     */
    public ReportRun runAt(LocalDateTime asOf) {
        Objects.requireNonNull(asOf, "asOf");
        long runId = reportRunRepository.create(asOf);
        CompletableFuture<ReportRun> run;
        try {
            run = CompletableFuture.supplyAsync(() -> execute(runId, asOf), runExecutor);
        } catch (TaskRejectedException e) {
            throw rejected(runId, e);
        }
        try {
            return run.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /** Koşuyu RUNNING olarak kaydeder ve arka planda başlatır. asOf null ise saatten okunur. */
    public ReportRun start(LocalDateTime asOf) {
        LocalDateTime pinnedAsOf = asOf != null ? asOf : LocalDateTime.now(clock);
        long runId = reportRunRepository.create(pinnedAsOf);
        try {
            runExecutor.execute(() -> execute(runId, pinnedAsOf));
        } catch (TaskRejectedException e) {
            throw rejected(runId, e);
        }
        log.info("Compliance run {} queued: as_of={}", runId, pinnedAsOf);
        return getRun(runId);
    }

    public ReportRun getRun(long runId) {
        return reportRunRepository.findById(runId)
                .orElseThrow(() -> new ReportRunNotFoundException(runId));
    }

    public List<ReportRun> listRuns(int limit) {
        return reportRunRepository.findRecent(limit);
    }

    ReportRun execute(long runId, LocalDateTime asOf) {
        long start = System.nanoTime();
        log.info("Compliance run {} started: as_of={}", runId, asOf);
        ComplianceReport report;
        try {
            ComplianceSnapshot snapshot = snapshotLoader.load();
            report = complianceEngine.compute(snapshot, asOf);

            transactionTemplate.executeWithoutResult(status -> {
                reportResultRepository.saveAll(runId, report);
                reportRunRepository.markSucceeded(runId, report);
            });
        } catch (RuntimeException | Error e) {
            log.error("Compliance run {} failed: {}", runId, e.getMessage(), e);
            reportRunRepository.markFailed(runId, Objects.requireNonNullElse(e.getMessage(), e.getClass().getName()));
            metrics.recordRunFailed(Duration.ofNanos(System.nanoTime() - start));
            if (e instanceof Error error) {
                throw error;
            }
            return getRun(runId);
        }

        // Sonuç commit edildi; buradan sonraki hata koşuyu FAILED yapmaz
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordRunSucceeded(report, duration);
        log.info("Compliance run {} succeeded in {}ms: history={}, qualified={}, never_signoff={}, risk={}, dropped={}",
                runId, duration.toMillis(),
                report.getHistory().getRows().size(),
                report.getQualified().getRows().size(),
                report.getNeverSignoff().getRows().size(),
                report.getRisk().getRows().size(),
                report.totalDropped());
        return getRun(runId);
    }

    private ComplianceRunRejectedException rejected(long runId, TaskRejectedException e) {
        log.warn("Compliance run {} rejected: run queue is full", runId);
        reportRunRepository.markFailed(runId, "Rejected: run queue is full");
        return new ComplianceRunRejectedException(
                "Too many compliance runs queued, try again later", REJECTED_RETRY_AFTER_SECONDS, e);
    }
}
