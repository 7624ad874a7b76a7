package com.baykanat.metrics.core.domain.model;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Point değerleri üzerindeki toplama fonksiyonu. */
public enum AggregationFunction {
    SUM("sum"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),
    COUNT("count"),
    LAST("last");

    private final String code;

    AggregationFunction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Hiç point yoksa değer 0 kabul edilir mi (threshold kuralları için).
     * sum/count/last → 0; avg/min/max için "hiçbir şeyin ortalaması" yok, entity üyelikten çıkarılır.
     */
    public boolean defaultsToZeroWhenAbsent() {
        return this == SUM || this == COUNT || this == LAST;
    }

    /** Boş → varsayılan (sum). */
    @JsonCreator
    public static AggregationFunction fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUM;
        }
        for (AggregationFunction agg : values()) {
            if (agg.code.equals(raw.trim())) {
                return agg;
            }
        }
        throw new MetricsValidationException("Invalid agg: " + raw);
    }
}
