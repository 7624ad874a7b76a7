package com.baykanat.metrics.core.domain.model.rule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Kuralı bir tablo kolonundaki kovaya bağlayan opsiyonel blok. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableBinding {

    private String tableId;
    private String columnKey;
    private String columnLabel;
    private String bucketLabel;
    private Integer sortOrder;
    private String entityIdField;
    /** Sadece table_metric kolonları: gösterim formatı ve ondalık hane (0-12). */
    private String format;
    private Integer decimals;
}
