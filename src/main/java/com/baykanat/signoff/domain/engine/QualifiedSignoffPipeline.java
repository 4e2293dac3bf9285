package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;
import com.baykanat.signoff.domain.model.ReferenceData;
import com.baykanat.signoff.domain.model.QualifiedSignoffRow;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.domain.model.SignoffEvent;
import lombok.RequiredArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Uygun kontratların (+30 gün penceresi) en son event'i, metod ayırt etmeksizin. Aynı max zamanı
 * paylaşan event'ler ayrı satır üretir; yalnızca birebir aynı satırlar tekilleşir.
 */
@RequiredArgsConstructor
public class QualifiedSignoffPipeline implements CompliancePipeline<QualifiedSignoffRow> {

    private final ContractUniverseFilter universeFilter;
    private final LatestSignoffResolver resolver;
    private final ComplianceClassifier classifier;

    @Override
    public ReportType type() {
        return ReportType.QUALIFIED_SIGNOFF;
    }

    @Override
    public PipelineResult<QualifiedSignoffRow> compute(SnapshotIndex index, LocalDateTime asOf) {
        DropTally tally = new DropTally();
        Set<QualifiedSignoffRow> rows = new LinkedHashSet<>();
        ReferenceData reference = index.reference();

        for (BookingContract contract : universeFilter.eligible(index.contracts(), EligibilityWindow.QUALIFICATION,
                asOf.toLocalDate(), tally)) {
            for (SignoffEvent latest : resolver.latestAnyMethod(index.liveEvents(contract.getBookingContract()))) {
                Optional<String> method = reference.signoffMethod(latest.getSignoffMethodId());
                if (method.isEmpty()) {
                    tally.record(DropTally.MISSING_SIGNOFF_METHOD);
                    continue;
                }
                Optional<String> identity = reference.signoffIdentity(latest.getSignOffIdentityId());
                if (identity.isEmpty()) {
                    tally.record(DropTally.MISSING_SIGNOFF_IDENTITY);
                    continue;
                }
                Optional<String> eventType = reference.signoffEventType(latest.getSignoffEventId());
                if (eventType.isEmpty()) {
                    tally.record(DropTally.MISSING_SIGNOFF_EVENT_TYPE);
                    continue;
                }

                long days = ComplianceClassifier.elapsedDays(latest.getCreateDtm(), asOf);
                rows.add(QualifiedSignoffRow.builder()
                        .bookingContract(contract.getBookingContract())
                        .ibvMethod(method.get())
                        .ibvIdentity(identity.get())
                        .ibvEvent(eventType.get())
                        .notes(latest.getNotes())
                        .qualifiedIbv(classifier.qualify(latest, days).getLabel())
                        .daysSinceLastSignoffEvent(days)
                        .lastSignoffDate(latest.getCreateDtm())
                        .build());
            }
        }
        return new PipelineResult<>(type(), new ArrayList<>(rows), tally);
    }
}
