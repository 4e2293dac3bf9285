package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Kontrat evrenini verilen pencereye göre süzer; her kontrat pipeline başına en fazla bir kez döner. */
@Slf4j
public class ContractUniverseFilter {

    /** Pencereye giren, silinmemiş kontratlar; giriş sırası korunur, tekrar eden id'ler atlanır. */
    public List<BookingContract> eligible(Collection<BookingContract> contracts, EligibilityWindow window,
                                          LocalDate asOfDate, DropTally tally) {
        List<BookingContract> eligible = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (BookingContract contract : contracts) {
            if (!contract.isDeleted() && !EligibilityWindow.hasAgreementDates(contract)) {
                tally.record(DropTally.INVALID_AGREEMENT_DATES);
                continue;
            }
            if (!window.isEligible(contract, asOfDate)) {
                continue;
            }
            if (!seen.add(contract.getBookingContract())) {
                log.warn("Duplicate booking contract {} in snapshot, evaluating first occurrence only",
                        contract.getBookingContract());
                tally.record(DropTally.DUPLICATE_CONTRACT);
                continue;
            }
            eligible.add(contract);
        }
        log.debug("{} window: {} of {} contracts eligible as of {}", window, eligible.size(), contracts.size(), asOfDate);
        return eligible;
    }
}
