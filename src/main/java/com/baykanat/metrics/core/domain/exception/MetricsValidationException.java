package com.baykanat.metrics.core.domain.exception;

/** Eksik/geçersiz alan, geçersiz enum, identifier ihlali, end <= start, fazla id; istek reddedilir → 400. */
public class MetricsValidationException extends RuntimeException {

    public MetricsValidationException(String message) {
        super(message);
    }

    public MetricsValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
