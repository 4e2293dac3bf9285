package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;
import com.baykanat.signoff.domain.model.NeverSignoffRow;
import com.baykanat.signoff.domain.model.OrgAttribution;
import com.baykanat.signoff.domain.model.ReportType;
import lombok.RequiredArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** +1 ay penceresindeki, event deposunda hiç izi olmayan kontratlar; sorumlu kullanıcı başına bir satır. */
@RequiredArgsConstructor
public class NeverSignoffPipeline implements CompliancePipeline<NeverSignoffRow> {

    private final ContractUniverseFilter universeFilter;
    private final NeverSignoffDetector detector;

    @Override
    public ReportType type() {
        return ReportType.NEVER_SIGNOFF;
    }

    @Override
    public PipelineResult<NeverSignoffRow> compute(SnapshotIndex index, LocalDateTime asOf) {
        DropTally tally = new DropTally();
        List<NeverSignoffRow> rows = new ArrayList<>();

        List<BookingContract> eligible = universeFilter.eligible(index.contracts(), EligibilityWindow.HISTORY,
                asOf.toLocalDate(), tally);
        for (BookingContract contract : detector.neverSignedOff(eligible, index.getTouchedContracts())) {
            Optional<ContractLabels> labels = ContractLabels.resolve(contract, index.reference(), tally);
            if (labels.isEmpty()) {
                continue;
            }
            for (OrgAttribution attribution : index.responsibleAttributions(contract.getBookingContract())) {
                rows.add(NeverSignoffRow.builder()
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
                        .build());
            }
        }
        return new PipelineResult<>(type(), rows, tally);
    }
}
