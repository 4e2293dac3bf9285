package com.baykanat.signoff.domain.exception;

/** Sorgulanacak başarılı bir koşu henüz yok → 409. */
public class NoSucceededRunException extends RuntimeException {

    public NoSucceededRunException(String message) {
        super(message);
    }
}
