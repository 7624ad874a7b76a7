package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** metric_points tablosu satırı için domain model (JDBC, JPA değil). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricPoint {

    private String id;
    private String entityKind;
    private String entityId;
    private String metricKey;
    private String dataSourceId;
    private String syncRunId;
    private String ingestBatchId;
    /** Granularity'ye göre kova başlangıcı. */
    private Instant date;
    private Granularity granularity;
    private BigDecimal value;
    private String dimensions; // JSONB (String olarak)
    private String dimensionsHash;
    private Instant createdAt;
    private Instant updatedAt;

    /** Upsert kimliği: (dataSourceId, metricKey, date, granularity, dimensionsHash). */
    public List<Object> identityKey() {
        return List.of(dataSourceId, metricKey, date, granularity, dimensionsHash);
    }
}
