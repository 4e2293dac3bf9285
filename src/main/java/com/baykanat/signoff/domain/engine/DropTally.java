package com.baykanat.signoff.domain.engine;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Bir pipeline'da sessizce düşürülen satırların sebep bazında sayacı. Çıktıyı etkilemez. */
public class DropTally {

    public static final String INVALID_AGREEMENT_DATES = "invalid_agreement_dates";
    public static final String DUPLICATE_CONTRACT = "duplicate_contract";
    public static final String MISSING_SERVICE_TYPE = "missing_service_type";
    public static final String MISSING_BUYING_PROGRAM = "missing_buying_program";
    public static final String MISSING_THEATER = "missing_theater";
    public static final String MISSING_PRICING_MODEL = "missing_pricing_model";
    public static final String MISSING_SIGNOFF_METHOD = "missing_signoff_method";
    public static final String MISSING_SIGNOFF_IDENTITY = "missing_signoff_identity";
    public static final String MISSING_SIGNOFF_EVENT_TYPE = "missing_signoff_event_type";
    public static final String MISSING_DEFER_REASON = "missing_defer_reason";
    public static final String MISSING_ENGAGEMENT = "missing_engagement";
    public static final String MISSING_USER = "missing_user";
    public static final String MISSING_FISCAL_PERIOD = "missing_fiscal_period";

    private final Map<String, Integer> counts = new TreeMap<>();

    public void record(String reason) {
        counts.merge(reason, 1, Integer::sum);
    }

    public int count(String reason) {
        return counts.getOrDefault(reason, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
