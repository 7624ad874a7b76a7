package com.baykanat.metrics.core.domain.exception;

/** Bilinmeyen segment key vb. → 404. */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
