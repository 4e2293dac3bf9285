package com.baykanat.signoff.api.dto;

import com.baykanat.signoff.domain.model.ReportType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** GET /reports/{type} sorgu parametreleri: hepsi isteğe bağlı; run_id yoksa son başarılı koşu. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Query parameters for report endpoints")
public class ReportQueryParams {

    @Schema(description = "Report to read")
    private ReportType type;

    @Schema(description = "Report run id; latest succeeded run when absent", example = "42")
    private Long runId;

    @Schema(description = "Exact booking contract filter", example = "BC-100234")
    private String bookingContract;

    @Schema(description = "Inclusive start date on the report's signoff date column", example = "2024-01-01")
    private LocalDate from;

    @Schema(description = "Inclusive end date on the report's signoff date column", example = "2024-03-31")
    private LocalDate to;

    @Schema(description = "Zero-based page index", example = "0")
    private int page;

    @Schema(description = "Page size", example = "50")
    private int size;

    public boolean hasDateRange() {
        return from != null || to != null;
    }
}
