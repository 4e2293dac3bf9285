package com.baykanat.signoff.api.dto;

import com.baykanat.signoff.domain.model.ReportRun;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/** Rapor koşusu durumu; POST /compliance/runs 202 gövdesi ve GET yanıtı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Compliance report run status")
public class ReportRunResponse {

    @JsonProperty("run_id")
    private Long runId;

    @JsonProperty("as_of")
    private LocalDateTime asOf;

    @JsonProperty("status")
    @Schema(example = "SUCCEEDED")
    private String status;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("finished_at")
    private Instant finishedAt;

    @JsonProperty("history_rows")
    private Integer historyRows;

    @JsonProperty("qualified_rows")
    private Integer qualifiedRows;

    @JsonProperty("never_signoff_rows")
    private Integer neverSignoffRows;

    @JsonProperty("risk_rows")
    private Integer riskRows;

    @JsonProperty("dropped_rows")
    private Integer droppedRows;

    @JsonProperty("error_message")
    private String errorMessage;

    public static ReportRunResponse from(ReportRun run) {
        return ReportRunResponse.builder()
                .runId(run.getId())
                .asOf(run.getAsOf())
                .status(run.getStatus().name())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .historyRows(run.getHistoryRows())
                .qualifiedRows(run.getQualifiedRows())
                .neverSignoffRows(run.getNeverSignoffRows())
                .riskRows(run.getRiskRows())
                .droppedRows(run.getDroppedRows())
                .errorMessage(run.getErrorMessage())
                .build();
    }
}
