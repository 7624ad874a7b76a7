package com.baykanat.metrics.core.domain.exception;

/** Geçerli ama desteklenmeyen kombinasyon (ör. user dışı entityKind için entity_attribute) → 400. */
public class UnsupportedCombinationException extends MetricsValidationException {

    public UnsupportedCombinationException(String message) {
        super(message);
    }
}
