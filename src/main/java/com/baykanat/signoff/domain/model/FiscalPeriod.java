package com.baykanat.signoff.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** fiscal_calendar satırı: takvim günü → mali çeyrek/ay/hafta etiketleri. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FiscalPeriod {

    private LocalDate calendarDate;
    private String fiscalQtrSortedName;
    private String fiscalMthSortedName;
    private String calWeekSortedShortName;
}
