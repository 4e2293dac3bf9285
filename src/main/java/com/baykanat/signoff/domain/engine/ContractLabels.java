package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;
import com.baykanat.signoff.domain.model.ReferenceData;
import lombok.Value;

import java.util.Optional;

/** Kontratın servis tipi, buying program, theater ve pricing model etiketleri (inner join). */
@Value
public class ContractLabels {

    String soldAsServiceName;
    String buyingProgramName;
    String bookedTheater;
    String pricingModelName;

    /** Dört dimension'dan biri eksikse boş döner ve ilk eksik olan sebep tally'ye yazılır. */
    public static Optional<ContractLabels> resolve(BookingContract contract, ReferenceData reference, DropTally tally) {
        Optional<String> service = reference.serviceType(contract.getSoldAsServiceTypeId());
        if (service.isEmpty()) {
            tally.record(DropTally.MISSING_SERVICE_TYPE);
            return Optional.empty();
        }
        Optional<String> buyingProgram = reference.buyingProgram(contract.getBuyingProgramTypeId());
        if (buyingProgram.isEmpty()) {
            tally.record(DropTally.MISSING_BUYING_PROGRAM);
            return Optional.empty();
        }
        Optional<String> theater = reference.theater(contract.getBookedTheaterId());
        if (theater.isEmpty()) {
            tally.record(DropTally.MISSING_THEATER);
            return Optional.empty();
        }
        Optional<String> pricingModel = reference.pricingModel(contract.getSoldAsPricingTypeId());
        if (pricingModel.isEmpty()) {
            tally.record(DropTally.MISSING_PRICING_MODEL);
            return Optional.empty();
        }
        return Optional.of(new ContractLabels(service.get(), buyingProgram.get(), theater.get(), pricingModel.get()));
    }
}
