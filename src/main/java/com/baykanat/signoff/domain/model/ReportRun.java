package com.baykanat.signoff.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/** report_runs satırı: bir koşunun sabitlenmiş as-of zamanı, durumu ve sayaçları. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportRun {

    public enum Status { RUNNING, SUCCEEDED, FAILED }

    private Long id;
    private LocalDateTime asOf;
    private Status status;
    private Instant startedAt;
    private Instant finishedAt;
    private int historyRows;
    private int qualifiedRows;
    private int neverSignoffRows;
    private int riskRows;
    private int droppedRows;
    private String errorMessage;
}
