package com.baykanat.signoff.api.controller;

import com.baykanat.signoff.api.dto.ReportPageResponse;
import com.baykanat.signoff.api.dto.ReportQueryParams;
import com.baykanat.signoff.config.AppProperties;
import com.baykanat.signoff.domain.exception.UnknownReportException;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.domain.service.ComplianceReportQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/** GET /reports/{report}: kaydedilmiş koşu sonuçlarını sayfalı döner. */
@Slf4j
@RestController
@RequestMapping("/reports")
@RequiredArgsConstructor
@Tag(name = "Compliance Reports", description = "Read-only access to computed signoff compliance reports")
public class ComplianceReportController {

    private final ComplianceReportQueryService queryService;
    private final AppProperties appProperties;

    @GetMapping("/{report}")
    @Operation(summary = "Read a compliance report",
            description = "signoff-history, qualified-signoff, never-signoff or risk-signoff rows of a report run")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report page"),
            @ApiResponse(responseCode = "400", description = "Invalid paging or date filter"),
            @ApiResponse(responseCode = "404", description = "Unknown report or run id"),
            @ApiResponse(responseCode = "409", description = "No succeeded run to read from")
    })
    public ResponseEntity<ReportPageResponse<Object>> getReport(
            @Parameter(description = "Report name", example = "risk-signoff")
            @PathVariable("report") String report,

            @Parameter(description = "Exact booking contract filter", example = "BC-100234")
            @RequestParam(value = "booking_contract", required = false) String bookingContract,

            @Parameter(description = "Inclusive start date (signoff-history and qualified-signoff only)", example = "2024-01-01")
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,

            @Parameter(description = "Inclusive end date (signoff-history and qualified-signoff only)", example = "2024-03-31")
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,

            @Parameter(description = "Report run id; latest succeeded run when absent", example = "42")
            @RequestParam(value = "run_id", required = false) Long runId,

            @Parameter(description = "Zero-based page index", example = "0")
            @RequestParam(value = "page", required = false, defaultValue = "0") int page,

            @Parameter(description = "Page size", example = "50")
            @RequestParam(value = "size", required = false) Integer size
    ) {
        log.debug("Received report query: report={}, run_id={}, booking_contract={}, page={}",
                report, runId, bookingContract, page);

        ReportType type = ReportType.fromPath(report)
                .orElseThrow(() -> new UnknownReportException(report));

        ReportQueryParams params = ReportQueryParams.builder()
                .type(type)
                .runId(runId)
                .bookingContract(bookingContract)
                .from(from)
                .to(to)
                .page(page)
                .size(size != null ? size : appProperties.getQuery().getDefaultPageSize())
                .build();

        return ResponseEntity.ok(queryService.query(params));
    }
}
