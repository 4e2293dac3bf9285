package com.baykanat.signoff.domain.exception;

/** Verilen id ile report_runs kaydı yok → 404. */
public class ReportRunNotFoundException extends RuntimeException {

    private final long runId;

    public ReportRunNotFoundException(long runId) {
        super("Report run not found: " + runId);
        this.runId = runId;
    }

    public long getRunId() {
        return runId;
    }
}
