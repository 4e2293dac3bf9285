package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;

import java.time.LocalDate;

/**
 * Kontratın as-of gününde değerlendirmeye girip girmediğini belirleyen pencereler.
 * Her rapor kendi penceresini kullanır; üçü bilerek ayrı tutulur, birleştirilmez.
 */
public enum EligibilityWindow {

    /** start ≤ bugün ≤ end + 1 takvim ayı (history ve never-signoff raporları). */
    HISTORY {
        @Override
        boolean contains(LocalDate start, LocalDate end, LocalDate asOfDate) {
            return !asOfDate.isBefore(start) && !asOfDate.isAfter(end.plusMonths(HISTORY_GRACE_MONTHS));
        }
    },

    /** start ≤ bugün ≤ end + 30 gün (qualified-signoff raporu). */
    QUALIFICATION {
        @Override
        boolean contains(LocalDate start, LocalDate end, LocalDate asOfDate) {
            return !asOfDate.isBefore(start) && !asOfDate.isAfter(end.plusDays(QUALIFICATION_GRACE_DAYS));
        }
    },

    /** start + 3 ay ≤ bugün ≤ end; en az 3 aylık ve bitmemiş kontratlar (risk raporu). */
    RISK {
        @Override
        boolean contains(LocalDate start, LocalDate end, LocalDate asOfDate) {
            return !asOfDate.isBefore(start.plusMonths(RISK_MINIMUM_AGE_MONTHS)) && !asOfDate.isAfter(end);
        }
    };

    public static final int HISTORY_GRACE_MONTHS = 1;
    public static final int QUALIFICATION_GRACE_DAYS = 30;
    public static final int RISK_MINIMUM_AGE_MONTHS = 3;

    abstract boolean contains(LocalDate start, LocalDate end, LocalDate asOfDate);

    /** Silinmiş ya da tarihi eksik kontrat hiçbir pencereye girmez. */
    public boolean isEligible(BookingContract contract, LocalDate asOfDate) {
        if (contract.isDeleted() || !hasAgreementDates(contract)) {
            return false;
        }
        return contains(contract.getAgreementStartDate(), contract.getAgreementEndDate(), asOfDate);
    }

    static boolean hasAgreementDates(BookingContract contract) {
        return contract.getAgreementStartDate() != null && contract.getAgreementEndDate() != null;
    }
}
