package com.baykanat.metrics.core.domain.model;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** "now"a göre çözülen isimli zaman penceresi. */
public enum WindowPreset {
    ALL_TIME("all_time"),
    LAST_7_DAYS("last_7_days"),
    LAST_30_DAYS("last_30_days"),
    LAST_90_DAYS("last_90_days"),
    MONTH_TO_DATE("month_to_date"),
    YEAR_TO_DATE("year_to_date");

    private final String code;

    WindowPreset(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static WindowPreset fromCode(String raw) {
        if (raw != null) {
            for (WindowPreset preset : values()) {
                if (preset.code.equals(raw.trim())) {
                    return preset;
                }
            }
        }
        throw new MetricsValidationException("Invalid window: " + raw);
    }
}
