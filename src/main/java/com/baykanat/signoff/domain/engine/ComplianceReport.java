package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.NeverSignoffRow;
import com.baykanat.signoff.domain.model.QualifiedSignoffRow;
import com.baykanat.signoff.domain.model.RiskSignoffRow;
import com.baykanat.signoff.domain.model.SignoffHistoryRow;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/** Tek koşunun dört rapor sonucu; hepsi aynı as-of ile hesaplanır. */
@Value
public class ComplianceReport {

    LocalDateTime asOf;
    PipelineResult<SignoffHistoryRow> history;
    PipelineResult<QualifiedSignoffRow> qualified;
    PipelineResult<NeverSignoffRow> neverSignoff;
    PipelineResult<RiskSignoffRow> risk;

    public List<PipelineResult<?>> results() {
        return List.of(history, qualified, neverSignoff, risk);
    }

    public int totalDropped() {
        return results().stream().mapToInt(result -> result.getDrops().total()).sum();
    }
}
