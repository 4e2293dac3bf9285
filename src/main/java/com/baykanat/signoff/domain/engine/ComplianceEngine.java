package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.ComplianceSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Dört raporu tek bir snapshot ve tek bir sabit as-of üzerinden hesaplar. Saat okumaz;
 * aynı girdi ve aynı as-of her zaman aynı satırları üretir.
 */
@Slf4j
public class ComplianceEngine {

    private final String hierarchyEmailDomain;
    private final NeverSignoffDetector detector;
    private final SignoffHistoryPipeline historyPipeline;
    private final QualifiedSignoffPipeline qualifiedPipeline;
    private final NeverSignoffPipeline neverSignoffPipeline;
    private final RiskSignoffPipeline riskPipeline;

    public ComplianceEngine(int deferredMethodId, String hierarchyEmailDomain) {
        this.hierarchyEmailDomain = Objects.requireNonNull(hierarchyEmailDomain, "hierarchyEmailDomain");
        ContractUniverseFilter universeFilter = new ContractUniverseFilter();
        LatestSignoffResolver resolver = new LatestSignoffResolver(deferredMethodId);
        ComplianceClassifier classifier = new ComplianceClassifier(resolver);
        this.detector = new NeverSignoffDetector();
        this.historyPipeline = new SignoffHistoryPipeline(universeFilter, resolver);
        this.qualifiedPipeline = new QualifiedSignoffPipeline(universeFilter, resolver, classifier);
        this.neverSignoffPipeline = new NeverSignoffPipeline(universeFilter, detector);
        this.riskPipeline = new RiskSignoffPipeline(universeFilter, resolver, classifier);
    }

    public ComplianceReport compute(ComplianceSnapshot snapshot, LocalDateTime asOf) {
        Objects.requireNonNull(asOf, "asOf");
        SnapshotIndex index = new SnapshotIndex(snapshot, hierarchyEmailDomain, detector);

        ComplianceReport report = new ComplianceReport(asOf,
                historyPipeline.compute(index, asOf),
                qualifiedPipeline.compute(index, asOf),
                neverSignoffPipeline.compute(index, asOf),
                riskPipeline.compute(index, asOf));

        for (PipelineResult<?> result : report.results()) {
            if (result.getDrops().total() > 0) {
                log.warn("{}: {} rows emitted, {} dropped {}", result.getType(), result.getRows().size(),
                        result.getDrops().total(), result.getDrops());
            } else {
                log.info("{}: {} rows emitted", result.getType(), result.getRows().size());
            }
        }
        return report;
    }
}
