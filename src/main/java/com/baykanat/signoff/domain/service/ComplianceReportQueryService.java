package com.baykanat.signoff.domain.service;

import com.baykanat.signoff.api.dto.ReportPageResponse;
import com.baykanat.signoff.api.dto.ReportQueryParams;
import com.baykanat.signoff.config.AppProperties;
import com.baykanat.signoff.domain.exception.InvalidReportQueryException;
import com.baykanat.signoff.domain.exception.NoSucceededRunException;
import com.baykanat.signoff.domain.exception.ReportRunNotFoundException;
import com.baykanat.signoff.domain.model.ReportRun;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.infrastructure.persistence.ReportResultJdbcRepository;
import com.baykanat.signoff.infrastructure.persistence.ReportRunJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/** Kaydedilmiş koşu sonuçlarından sayfalı okuma; run_id yoksa son başarılı koşu. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceReportQueryService {

    private final ReportRunJdbcRepository reportRunRepository;
    private final ReportResultJdbcRepository reportResultRepository;
    private final AppProperties appProperties;

    public ReportPageResponse<Object> query(ReportQueryParams params) {
        validate(params);
        ReportRun run = resolveRun(params);
        ReportType type = params.getType();

        long total = reportResultRepository.count(type, run.getId(), params.getBookingContract(),
                params.getFrom(), params.getTo());
        List<?> rows = total == 0 ? List.of() : reportResultRepository.findPage(type, run.getId(),
                params.getBookingContract(), params.getFrom(), params.getTo(), params.getPage(), params.getSize());

        log.debug("Report query: type={}, run_id={}, page={}, size={}, total={}",
                type.getPath(), run.getId(), params.getPage(), params.getSize(), total);

        return ReportPageResponse.<Object>builder()
                .report(type.getPath())
                .runId(run.getId())
                .asOf(run.getAsOf())
                .page(params.getPage())
                .size(params.getSize())
                .totalElements(total)
                .totalPages((int) ((total + params.getSize() - 1) / params.getSize()))
                .rows(new ArrayList<>(rows))
                .build();
    }

    private void validate(ReportQueryParams params) {
        int maxPageSize = appProperties.getQuery().getMaxPageSize();
        if (params.getPage() < 0) {
            throw new InvalidReportQueryException("page must be zero or greater");
        }
        if (params.getSize() < 1 || params.getSize() > maxPageSize) {
            throw new InvalidReportQueryException("size must be between 1 and " + maxPageSize);
        }
        if (params.hasDateRange() && !params.getType().supportsDateRange()) {
            throw new InvalidReportQueryException(
                    "Report " + params.getType().getPath() + " has no signoff date; from/to are not supported");
        }
        if (params.getFrom() != null && params.getTo() != null && params.getFrom().isAfter(params.getTo())) {
            throw new InvalidReportQueryException("from must not be after to");
        }
    }

    private ReportRun resolveRun(ReportQueryParams params) {
        if (params.getRunId() == null) {
            return reportRunRepository.findLatestSucceeded()
                    .orElseThrow(() -> new NoSucceededRunException("No succeeded compliance report run exists yet"));
        }

        ReportRun run = reportRunRepository.findById(params.getRunId())
                .orElseThrow(() -> new ReportRunNotFoundException(params.getRunId()));
        if (run.getStatus() != ReportRun.Status.SUCCEEDED) {
            throw new NoSucceededRunException("Report run " + run.getId() + " has status " + run.getStatus());
        }
        return run;
    }
}
