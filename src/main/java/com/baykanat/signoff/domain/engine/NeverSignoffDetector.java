package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;
import com.baykanat.signoff.domain.model.SignoffEvent;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Event deposunda hiç izi olmayan kontratlar (anti-join). Silinmiş event'ler de iz sayılır:
 * yalnızca silinmiş event'i olan kontrat "hiç signoff yapılmamış" listesine girmez.
 */
public class NeverSignoffDetector {

    /** Ham event deposundaki (silinmişler dahil) tüm kontrat id'leri. */
    public Set<String> touchedContracts(Collection<SignoffEvent> rawEvents) {
        return rawEvents.stream()
                .map(SignoffEvent::getBookingContract)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    public List<BookingContract> neverSignedOff(List<BookingContract> eligible, Set<String> touchedContracts) {
        return eligible.stream()
                .filter(contract -> !touchedContracts.contains(contract.getBookingContract()))
                .toList();
    }
}
