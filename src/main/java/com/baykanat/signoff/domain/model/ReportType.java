package com.baykanat.signoff.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/** Dört çıktı raporu; path segment'i REST'te, table adı persistence'ta kullanılır. */
@Getter
@RequiredArgsConstructor
public enum ReportType {

    SIGNOFF_HISTORY("signoff-history", "signoff_history_results", "signoff_create_dtm"),
    QUALIFIED_SIGNOFF("qualified-signoff", "qualified_signoff_results", "last_signoff_date"),
    NEVER_SIGNOFF("never-signoff", "never_signoff_results", null),
    RISK_SIGNOFF("risk-signoff", "risk_signoff_results", null);

    private final String path;
    private final String table;
    /** Tarih aralığı filtresinin uygulandığı kolon; null ise rapor tarih filtresi desteklemez. */
    private final String dateColumn;

    public boolean supportsDateRange() {
        return dateColumn != null;
    }

    public static Optional<ReportType> fromPath(String path) {
        return Arrays.stream(values())
                .filter(type -> type.path.equalsIgnoreCase(path))
                .findFirst();
    }
}
