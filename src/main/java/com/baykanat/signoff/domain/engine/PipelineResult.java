package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.ReportType;
import lombok.Value;

import java.util.List;

/** Bir pipeline'ın satırları ve düşürülen satır sayaçları. */
@Value
public class PipelineResult<T> {

    ReportType type;
    List<T> rows;
    DropTally drops;
}
