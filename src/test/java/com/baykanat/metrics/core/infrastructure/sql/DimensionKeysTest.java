package com.baykanat.metrics.core.infrastructure.sql;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DimensionKeysTest {

    @ParameterizedTest
    @ValueSource(strings = {"country", "Platform_2", "a", "_x"})
    @DisplayName("Valid keys produce a JSON extraction expression")
    void validKeys(String key) {
        assertThat(DimensionKeys.extract(key)).isEqualTo("(dimensions ->> '" + key + "')");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a-b", "x'); DROP TABLE metric_points; --", "with space", "ülke"})
    @DisplayName("Keys outside the allow-list are rejected before reaching SQL")
    void invalidKeys(String key) {
        assertThat(DimensionKeys.isValid(key)).isFalse();
        assertThatThrownBy(() -> DimensionKeys.extract(key))
                .isInstanceOf(MetricsValidationException.class)
                .hasMessageStartingWith("Invalid dimension key");
    }

    @Test
    @DisplayName("groupBy keys may not shadow the reserved output columns")
    void reservedGroupByKeys() {
        assertThatThrownBy(() -> DimensionKeys.requireGroupByKeys(List.of("country", "value")))
                .isInstanceOf(MetricsValidationException.class)
                .hasMessageContaining("reserved");
    }
}
