package com.baykanat.signoff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/** Bir rapor sayfası: hangi koşudan geldiği, sayfalama bilgisi ve satırlar. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paginated report rows")
public class ReportPageResponse<T> {

    @JsonProperty("report")
    @Schema(description = "Report name", example = "risk-signoff")
    private String report;

    @JsonProperty("run_id")
    @Schema(description = "Report run the rows belong to", example = "42")
    private long runId;

    @JsonProperty("as_of")
    @Schema(description = "Pinned as-of timestamp of the run", example = "2024-07-29T00:00:00")
    private LocalDateTime asOf;

    @JsonProperty("page")
    private int page;

    @JsonProperty("size")
    private int size;

    @JsonProperty("total_elements")
    private long totalElements;

    @JsonProperty("total_pages")
    private int totalPages;

    @JsonProperty("rows")
    private List<T> rows;
}
