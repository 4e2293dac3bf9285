package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;
import com.baykanat.signoff.domain.model.OrgAttribution;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.domain.model.RiskBucket;
import com.baykanat.signoff.domain.model.RiskSignoffRow;
import lombok.RequiredArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * En az 3 aylık, bitmemiş kontratların son deferred-olmayan signoff'una göre risk kovası.
 * Hiç uygun event'i olmayan kontrat bu rapora girmez.
 */
@RequiredArgsConstructor
public class RiskSignoffPipeline implements CompliancePipeline<RiskSignoffRow> {

    private final ContractUniverseFilter universeFilter;
    private final LatestSignoffResolver resolver;
    private final ComplianceClassifier classifier;

    @Override
    public ReportType type() {
        return ReportType.RISK_SIGNOFF;
    }

    @Override
    public PipelineResult<RiskSignoffRow> compute(SnapshotIndex index, LocalDateTime asOf) {
        DropTally tally = new DropTally();
        List<RiskSignoffRow> rows = new ArrayList<>();

        for (BookingContract contract : universeFilter.eligible(index.contracts(), EligibilityWindow.RISK,
                asOf.toLocalDate(), tally)) {
            Optional<LocalDateTime> lastSignoff = resolver.latestNonDeferredTimestamp(
                    index.liveEvents(contract.getBookingContract()));
            if (lastSignoff.isEmpty()) {
                continue;
            }
            Optional<ContractLabels> labels = ContractLabels.resolve(contract, index.reference(), tally);
            if (labels.isEmpty()) {
                continue;
            }

            long days = ComplianceClassifier.elapsedDays(lastSignoff.get(), asOf);
            String risk = classifier.riskBucket(days).map(RiskBucket::getLabel).orElse(null);
            for (OrgAttribution attribution : index.responsibleAttributions(contract.getBookingContract())) {
                rows.add(RiskSignoffRow.builder()
                        .bookingContract(contract.getBookingContract())
                        .soldAsServiceName(labels.get().getSoldAsServiceName())
                        .bookingCountry(contract.getBookingCountry())
                        .buyingProgramName(labels.get().getBuyingProgramName())
                        .pricingModelName(labels.get().getPricingModelName())
                        .bookedTheater(labels.get().getBookedTheater())
                        .attribution(attribution)
                        .accountName(contract.getAccountName())
                        .soldAsSwAllocation(contract.getSoldAsSwAllocation())
                        .soldAsHwAllocation(contract.getSoldAsHwAllocation())
                        .signoffDaysAgo(days)
                        .signoffRisk(risk)
                        .build());
            }
        }
        return new PipelineResult<>(type(), rows, tally);
    }
}
