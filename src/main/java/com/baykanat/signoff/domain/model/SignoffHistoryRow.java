package com.baykanat.signoff.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * signoff_history satırı: uygun kontratın her silinmemiş signoff event'i için bir satır.
 * Event'i olmayan kontrat signoff alanları null olan tek satırla görünür.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignoffHistoryRow {

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

    @JsonProperty("reference_booking_contract")
    private String referenceBookingContract;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("sign_off_identity")
    private String signOffIdentity;

    @JsonProperty("signoff_method")
    private String signoffMethod;

    @JsonProperty("defer_signoff_reason")
    private String deferSignoffReason;

    @JsonProperty("engagement_name")
    private String engagementName;

    @JsonProperty("dc_engagement_id")
    private Long dcEngagementId;

    @JsonProperty("booking_contract")
    private String bookingContract;

    @JsonProperty("user_title")
    private String userTitle;

    @JsonProperty("fiscal_qtr_sorted_name")
    private String fiscalQtrSortedName;

    @JsonProperty("fiscal_mth_sorted_name")
    private String fiscalMthSortedName;

    @JsonProperty("cal_week_sorted_short_name")
    private String calWeekSortedShortName;

    @JsonProperty("create_dtm")
    private LocalDateTime createDtm;

    @JsonProperty("signoff_days_ago")
    private Long signoffDaysAgo;

    @JsonProperty("dc_user_id")
    private Long dcUserId;

    @JsonProperty("signoff_create_dtm")
    private LocalDateTime signoffCreateDtm;

    @JsonProperty("is_last_signoff")
    private boolean lastSignoff;

    @JsonUnwrapped
    private OrgAttribution attribution;

    @JsonProperty("account_name")
    private String accountName;

    @JsonProperty("sold_as_sw_allocation")
    private BigDecimal soldAsSwAllocation;

    @JsonProperty("sold_as_hw_allocation")
    private BigDecimal soldAsHwAllocation;
}
