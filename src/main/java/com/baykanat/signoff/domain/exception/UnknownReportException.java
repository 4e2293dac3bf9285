package com.baykanat.signoff.domain.exception;

/** /reports/{type} altında tanımlı olmayan rapor adı → 404. */
public class UnknownReportException extends RuntimeException {

    public UnknownReportException(String report) {
        super("Unknown report: " + report);
    }
}
