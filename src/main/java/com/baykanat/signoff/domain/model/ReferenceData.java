package com.baykanat.signoff.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Bir koşu boyunca değişmeyen dimension tabloları. Her lookup Optional döner;
 * eşleşme yoksa çağıran taraf satırı inner join semantiğiyle düşürür.
 */
@Getter
@Builder
public class ReferenceData {

    @Singular
    private final Map<Integer, String> serviceTypes;
    @Singular
    private final Map<Integer, String> buyingPrograms;
    @Singular
    private final Map<Integer, String> theaters;
    @Singular
    private final Map<Integer, String> pricingModels;
    @Singular
    private final Map<Integer, String> signoffMethods;
    @Singular
    private final Map<Integer, String> signoffIdentities;
    @Singular
    private final Map<Integer, String> deferReasons;
    @Singular
    private final Map<Integer, String> signoffEventTypes;
    @Singular
    private final Map<Long, String> engagements;
    @Singular("fiscalPeriod")
    private final Map<LocalDate, FiscalPeriod> fiscalCalendar;

    public Optional<String> serviceType(Integer id) {
        return lookup(serviceTypes, id);
    }

    public Optional<String> buyingProgram(Integer id) {
        return lookup(buyingPrograms, id);
    }

    public Optional<String> theater(Integer id) {
        return lookup(theaters, id);
    }

    public Optional<String> pricingModel(Integer id) {
        return lookup(pricingModels, id);
    }

    public Optional<String> signoffMethod(Integer id) {
        return lookup(signoffMethods, id);
    }

    public Optional<String> signoffIdentity(Integer id) {
        return lookup(signoffIdentities, id);
    }

    public Optional<String> deferReason(Integer id) {
        return lookup(deferReasons, id);
    }

    public Optional<String> signoffEventType(Integer id) {
        return lookup(signoffEventTypes, id);
    }

    public Optional<String> engagement(Long id) {
        return lookup(engagements, id);
    }

    public Optional<FiscalPeriod> fiscalPeriod(LocalDate date) {
        return lookup(fiscalCalendar, date);
    }

    // null key SQL'deki gibi hiçbir satırla eşleşmez
    private static <K, V> Optional<V> lookup(Map<K, V> table, K key) {
        return key == null ? Optional.empty() : Optional.ofNullable(table.get(key));
    }
}
