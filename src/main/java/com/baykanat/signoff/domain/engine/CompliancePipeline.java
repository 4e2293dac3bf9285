package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.ReportType;

import java.time.LocalDateTime;

/** Snapshot + sabit as-of → tek bir rapor. Uygulamalar durumsuzdur ve saat okumaz. */
public interface CompliancePipeline<T> {

    ReportType type();

    PipelineResult<T> compute(SnapshotIndex index, LocalDateTime asOf);
}
