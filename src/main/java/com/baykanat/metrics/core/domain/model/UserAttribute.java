package com.baykanat.metrics.core.domain.model;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kullanıcı dizininde sorgulanabilen attribute'lar; column adı sabit, kullanıcıdan gelmez. */
public enum UserAttribute {
    ROLE("role", "role"),
    EMAIL_VERIFIED("email_verified", "email_verified"),
    LOCKED("locked", "locked");

    private final String code;
    private final String column;

    UserAttribute(String code, String column) {
        this.code = code;
        this.column = column;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String column() {
        return column;
    }

    public boolean isBoolean() {
        return this != ROLE;
    }

    @JsonCreator
    public static UserAttribute fromCode(String raw) {
        if (raw != null) {
            for (UserAttribute attribute : values()) {
                if (attribute.code.equals(raw.trim())) {
                    return attribute;
                }
            }
        }
        throw new MetricsValidationException("Unsupported attribute: " + raw);
    }
}
