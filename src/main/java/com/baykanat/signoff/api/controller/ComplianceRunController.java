package com.baykanat.signoff.api.controller;

import com.baykanat.signoff.api.dto.ReportRunResponse;
import com.baykanat.signoff.domain.model.ReportRun;
import com.baykanat.signoff.domain.service.ComplianceRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.LocalDateTime;
import java.util.List;

/** Rapor koşuları: başlatma (async, 202), durum sorgusu ve son koşular listesi. */
@Slf4j
@RestController
@RequestMapping("/compliance/runs")
@RequiredArgsConstructor
@Validated
@Tag(name = "Compliance Runs", description = "Recompute compliance reports against a pinned as-of timestamp")
public class ComplianceRunController {

    private final ComplianceRunService complianceRunService;

    @PostMapping
    @Operation(summary = "Start a report run", description = "Queues a recompute of all four reports; as_of defaults to now")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Run accepted"),
            @ApiResponse(responseCode = "400", description = "Invalid as_of"),
            @ApiResponse(responseCode = "503", description = "Run queue is full")
    })
    public ResponseEntity<ReportRunResponse> startRun(
            @Parameter(description = "As-of timestamp (ISO-8601 local date-time)", example = "2024-07-29T00:00:00")
            @RequestParam(value = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime asOf) {
        log.debug("Received compliance run request: as_of={}", asOf);

        ReportRun run = complianceRunService.start(asOf);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .location(URI.create("/compliance/runs/" + run.getId()))
                .body(ReportRunResponse.from(run));
    }

    @GetMapping("/{runId}")
    @Operation(summary = "Get a report run", description = "Returns status and row counts of a run")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Run found"),
            @ApiResponse(responseCode = "404", description = "Unknown run id")
    })
    public ResponseEntity<ReportRunResponse> getRun(@PathVariable("runId") long runId) {
        return ResponseEntity.ok(ReportRunResponse.from(complianceRunService.getRun(runId)));
    }

    @GetMapping
    @Operation(summary = "List recent report runs", description = "Most recent runs first")
    public ResponseEntity<List<ReportRunResponse>> listRuns(
            @Parameter(description = "Maximum number of runs to return", example = "20")
            @RequestParam(value = "limit", required = false, defaultValue = "20") @Min(1) @Max(200) int limit) {
        List<ReportRunResponse> runs = complianceRunService.listRuns(limit).stream()
                .map(ReportRunResponse::from)
                .toList();
        return ResponseEntity.ok(runs);
    }
}
