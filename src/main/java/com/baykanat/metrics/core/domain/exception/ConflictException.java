package com.baykanat.metrics.core.domain.exception;

/** Aynı key ile ikinci kayıt → 409. */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
