package com.baykanat.signoff.domain.exception;

/** Rapor sorgusu parametreleri geçersiz (sayfa boyutu, tarih aralığı) → 400. */
public class InvalidReportQueryException extends RuntimeException {

    public InvalidReportQueryException(String message) {
        super(message);
    }
}
