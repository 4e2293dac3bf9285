package com.baykanat.signoff.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/** booking_contracts satırı; kontrat sistemine ait, burada salt okunur. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingContract {

    private String bookingContract;
    private LocalDate agreementStartDate;
    private LocalDate agreementEndDate;
    private boolean deleted;
    private String accountName;
    private String bookingCountry;
    private Integer bookedTheaterId;
    private Integer soldAsServiceTypeId;
    private Integer buyingProgramTypeId;
    private Integer soldAsPricingTypeId;
    private BigDecimal soldAsSwAllocation;
    private BigDecimal soldAsHwAllocation;
}
