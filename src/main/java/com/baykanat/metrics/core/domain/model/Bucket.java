package com.baykanat.metrics.core.domain.model;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/** Sorgu zaman kovası; date_trunc birimi ve drilldown için kova genişliği. */
public enum Bucket {
    NONE("none"),
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month");

    private final String code;

    Bucket(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isNone() {
        return this == NONE;
    }

    /** Kova başlangıcından bir sonraki kovanın başlangıcı; ay UTC takvimine göre (DST kayması yok). */
    public Instant endOf(Instant bucketStart) {
        return switch (this) {
            case HOUR -> bucketStart.plus(Duration.ofHours(1));
            case DAY -> bucketStart.plus(Duration.ofDays(1));
            case WEEK -> bucketStart.plus(Duration.ofDays(7));
            case MONTH -> bucketStart.atOffset(ZoneOffset.UTC).plusMonths(1).toInstant();
            case NONE -> throw new IllegalStateException("Bucket 'none' has no width");
        };
    }

    /** Boş → varsayılan (day). */
    public static Bucket fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return DAY;
        }
        for (Bucket bucket : values()) {
            if (bucket.code.equals(raw.trim())) {
                return bucket;
            }
        }
        throw new MetricsValidationException("Invalid bucket: " + raw);
    }
}
