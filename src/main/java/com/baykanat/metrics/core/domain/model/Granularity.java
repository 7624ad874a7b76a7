package com.baykanat.metrics.core.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/** Kaynağın point ürettiği doğal sıklık; sorgu kovasından bağımsız. */
public enum Granularity {
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String code;

    Granularity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Optional<Granularity> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        for (Granularity granularity : values()) {
            if (granularity.code.equals(trimmed)) {
                return Optional.of(granularity);
            }
        }
        return Optional.empty();
    }
}
