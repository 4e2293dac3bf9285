package com.baykanat.signoff.domain.exception;

/** Koşu kuyruğu dolu; istemci Retry-After sonrası tekrar dener → 503. */
public class ComplianceRunRejectedException extends RuntimeException {

    private final int retryAfterSeconds;

    public ComplianceRunRejectedException(String message, int retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
