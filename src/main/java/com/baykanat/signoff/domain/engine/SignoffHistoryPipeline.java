package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;
import com.baykanat.signoff.domain.model.DcUser;
import com.baykanat.signoff.domain.model.FiscalPeriod;
import com.baykanat.signoff.domain.model.OrgAttribution;
import com.baykanat.signoff.domain.model.ReferenceData;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.domain.model.SignoffEvent;
import com.baykanat.signoff.domain.model.SignoffHistoryRow;
import lombok.RequiredArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Uygun kontratların (+1 ay penceresi) tüm silinmemiş event'leri, "son signoff" bayrağıyla.
 * Kazanan, event dimension join'lerinden önce ham event'ler üzerinde belirlenir; kazanan event
 * join'de düşerse kontratta bayraklı satır kalmaz. Event satırı kalmayan kontrat tek boş satır üretir.
 */
@RequiredArgsConstructor
public class SignoffHistoryPipeline implements CompliancePipeline<SignoffHistoryRow> {

    private final ContractUniverseFilter universeFilter;
    private final LatestSignoffResolver resolver;

    @Override
    public ReportType type() {
        return ReportType.SIGNOFF_HISTORY;
    }

    @Override
    public PipelineResult<SignoffHistoryRow> compute(SnapshotIndex index, LocalDateTime asOf) {
        DropTally tally = new DropTally();
        List<SignoffHistoryRow> rows = new ArrayList<>();

        for (BookingContract contract : universeFilter.eligible(index.contracts(), EligibilityWindow.HISTORY,
                asOf.toLocalDate(), tally)) {
            Optional<ContractLabels> labels = ContractLabels.resolve(contract, index.reference(), tally);
            if (labels.isEmpty()) {
                continue;
            }

            List<SignoffEvent> events = index.liveEvents(contract.getBookingContract());
            Optional<SignoffEvent> winner = resolver.lastQualifying(events);

            List<SignoffHistoryRow> contractRows = new ArrayList<>();
            for (SignoffEvent event : events) {
                eventRow(contract, labels.get(), event, resolver.matchesWinner(event, winner), index, asOf, tally)
                        .ifPresent(contractRows::add);
            }
            if (contractRows.isEmpty()) {
                contractRows.add(contractOnlyRow(contract, labels.get()));
            }
            rows.addAll(contractRows);
        }
        return new PipelineResult<>(type(), rows, tally);
    }

    private Optional<SignoffHistoryRow> eventRow(BookingContract contract, ContractLabels labels, SignoffEvent event,
                                                 boolean lastSignoff, SnapshotIndex index, LocalDateTime asOf,
                                                 DropTally tally) {
        if (event.getCreateDtm() == null) {
            return Optional.empty();
        }
        ReferenceData reference = index.reference();

        Optional<String> deferReason = reference.deferReason(event.getDeferSignoffReasonId());
        if (deferReason.isEmpty()) {
            tally.record(DropTally.MISSING_DEFER_REASON);
            return Optional.empty();
        }
        Optional<String> engagement = reference.engagement(event.getDcEngagementId());
        if (engagement.isEmpty()) {
            tally.record(DropTally.MISSING_ENGAGEMENT);
            return Optional.empty();
        }
        Optional<String> method = reference.signoffMethod(event.getSignoffMethodId());
        if (method.isEmpty()) {
            tally.record(DropTally.MISSING_SIGNOFF_METHOD);
            return Optional.empty();
        }
        Optional<String> identity = reference.signoffIdentity(event.getSignOffIdentityId());
        if (identity.isEmpty()) {
            tally.record(DropTally.MISSING_SIGNOFF_IDENTITY);
            return Optional.empty();
        }
        Optional<DcUser> user = index.user(event.getDcUserId());
        if (user.isEmpty()) {
            tally.record(DropTally.MISSING_USER);
            return Optional.empty();
        }
        Optional<FiscalPeriod> period = reference.fiscalPeriod(event.getCreateDtm().toLocalDate());
        if (period.isEmpty()) {
            tally.record(DropTally.MISSING_FISCAL_PERIOD);
            return Optional.empty();
        }

        OrgAttribution attribution = index.getAttributionResolver().resolve(event.getDcUserId());
        return Optional.of(contractRowBuilder(contract, labels)
                .notes(event.getNotes())
                .signOffIdentity(identity.get())
                .signoffMethod(method.get())
                .deferSignoffReason(deferReason.get())
                .engagementName(engagement.get())
                .dcEngagementId(event.getDcEngagementId())
                .bookingContract(event.getBookingContract())
                .userTitle(user.get().getUserTitle())
                .fiscalQtrSortedName(period.get().getFiscalQtrSortedName())
                .fiscalMthSortedName(period.get().getFiscalMthSortedName())
                .calWeekSortedShortName(period.get().getCalWeekSortedShortName())
                .createDtm(event.getCreateDtm())
                .signoffDaysAgo(ComplianceClassifier.elapsedDays(event.getCreateDtm(), asOf))
                .dcUserId(event.getDcUserId())
                .signoffCreateDtm(event.getCreateDtm())
                .lastSignoff(lastSignoff)
                .attribution(attribution)
                .build());
    }

    private SignoffHistoryRow contractOnlyRow(BookingContract contract, ContractLabels labels) {
        return contractRowBuilder(contract, labels)
                .lastSignoff(false)
                .attribution(OrgAttribution.NOT_ASSIGNED_ATTRIBUTION)
                .build();
    }

    private SignoffHistoryRow.SignoffHistoryRowBuilder contractRowBuilder(BookingContract contract, ContractLabels labels) {
        return SignoffHistoryRow.builder()
                .soldAsServiceName(labels.getSoldAsServiceName())
                .bookingCountry(contract.getBookingCountry())
                .buyingProgramName(labels.getBuyingProgramName())
                .pricingModelName(labels.getPricingModelName())
                .bookedTheater(labels.getBookedTheater())
                .referenceBookingContract(contract.getBookingContract())
                .accountName(contract.getAccountName())
                .soldAsSwAllocation(contract.getSoldAsSwAllocation())
                .soldAsHwAllocation(contract.getSoldAsHwAllocation());
    }
}
