package com.baykanat.metrics.core.domain.model;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** ISO-8601 instant, offset date-time veya yyyy-MM-dd (UTC gece yarısı) parse eder. */
public final class Timestamps {

    private Timestamps() {
    }

    public static Optional<Instant> tryParse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String s = raw.trim();
        try {
            return Optional.of(Instant.parse(s));
        } catch (DateTimeParseException ignored) {
            // offset veya tarih formatı denenir
        }
        try {
            return Optional.of(OffsetDateTime.parse(s).toInstant());
        } catch (DateTimeParseException ignored) {
            // tarih formatı denenir
        }
        try {
            return Optional.of(LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Boş → null; parse edilemezse "Invalid {label}". */
    public static Instant parseOptional(String label, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return tryParse(raw).orElseThrow(() -> new MetricsValidationException("Invalid " + label));
    }

    /** İki uç da varsa end > start olmalı. */
    public static void requireOrdered(String endLabel, String startLabel, Instant start, Instant end) {
        if (start != null && end != null && !end.isAfter(start)) {
            throw new MetricsValidationException(endLabel + " must be after " + startLabel);
        }
    }
}
