package com.baykanat.signoff.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/** risk_signoff satırı; signoffRisk, gün sayısı hiçbir aralığa düşmezse (gelecek tarih) null kalır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskSignoffRow {

    @JsonProperty("booking_contract")
    private String bookingContract;

    @JsonProperty("sold_as_service_name")
    private String soldAsServiceName;

    @JsonProperty("booking_country")
    private String bookingCountry;

    @JsonProperty("buying_program_name")
    private String buyingProgramName;

    @JsonProperty("pricing_model_name")
    private String pricingModelName;

    @JsonProperty("booked_theater")
    private String bookedTheater;

    @JsonUnwrapped
    private OrgAttribution attribution;

    @JsonProperty("account_name")
    private String accountName;

    @JsonProperty("sold_as_sw_allocation")
    private BigDecimal soldAsSwAllocation;

    @JsonProperty("sold_as_hw_allocation")
    private BigDecimal soldAsHwAllocation;

    @JsonProperty("signoff_days_ago")
    private long signoffDaysAgo;

    @JsonProperty("signoff_risk")
    private String signoffRisk;
}
