package com.baykanat.signoff.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** qualified_signoff satırı: kontratın en son event'i ve as-of'a göre nitelendirilmiş durumu. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualifiedSignoffRow {

    @JsonProperty("booking_contract")
    private String bookingContract;

    @JsonProperty("ibv_method")
    private String ibvMethod;

    @JsonProperty("ibv_identity")
    private String ibvIdentity;

    @JsonProperty("ibv_event")
    private String ibvEvent;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("qualified_ibv")
    private String qualifiedIbv;

    @JsonProperty("days_since_last_signoff_event")
    private long daysSinceLastSignoffEvent;

    @JsonProperty("last_signoff_date")
    private LocalDateTime lastSignoffDate;
}
