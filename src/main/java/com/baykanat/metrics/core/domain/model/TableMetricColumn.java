package com.baykanat.metrics.core.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;

/** table_metric segmentinden çözülmüş hesaplanmış kolon tanımı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableMetricColumn {

    /** sortOrder artan, sonra etiket, sonra kolon key. */
    public static final Comparator<TableMetricColumn> DISPLAY_ORDER = Comparator
            .comparingInt(TableMetricColumn::getSortOrder)
            .thenComparing(TableMetricColumn::getColumnLabel)
            .thenComparing(TableMetricColumn::getColumnKey);

    private String segmentKey;
    private String columnKey;
    private String columnLabel;
    private String entityKind;
    private String entityIdField;
    private String metricKey;
    private AggregationFunction agg;
    private WindowPreset window;
    private String format;
    private Integer decimals;
    private int sortOrder;

    /** Point'i olmayan entity için 0 gösterilir mi; sadece sum ve count. */
    @JsonIgnore
    public boolean showsZeroWhenAbsent() {
        return agg == AggregationFunction.SUM || agg == AggregationFunction.COUNT;
    }
}
