package com.baykanat.metrics.core.domain.model.rule;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.WindowPreset;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Üyelik kuralı değil: tablo kolonunda entity başına gösterilen hesaplanmış metrik değeri.
 * Segment olarak saklanır; table bloğu zorunludur.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class TableMetricRule extends SegmentRule {

    private String metricKey;
    private AggregationFunction agg;
    private WindowPreset window;

    @Override
    public RuleKind ruleKind() {
        return RuleKind.TABLE_METRIC;
    }

    @Override
    public void validate(String entityKind) {
        if (metricKey == null || metricKey.isBlank()) {
            throw new MetricsValidationException("Missing rule.metricKey");
        }
        TableBinding table = getTable();
        if (table == null || isBlank(table.getTableId()) || isBlank(table.getColumnKey())) {
            throw new MetricsValidationException("table_metric requires rule.table.tableId and rule.table.columnKey");
        }
        Integer decimals = table.getDecimals();
        if (decimals != null && (decimals < 0 || decimals > 12)) {
            throw new MetricsValidationException("rule.table.decimals must be between 0 and 12");
        }
    }

    /** Boşsa sum. */
    @JsonIgnore
    public AggregationFunction effectiveAgg() {
        return agg != null ? agg : AggregationFunction.SUM;
    }

    @JsonIgnore
    public WindowPreset effectiveWindow() {
        return window != null ? window : WindowPreset.ALL_TIME;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
