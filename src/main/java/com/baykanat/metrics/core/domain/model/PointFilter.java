package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Doğrulanmış ham point filtresi; sorgu, drilldown ve contributor sorguları ortak kullanır. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PointFilter {

    private String metricKey;
    private Instant start;
    private Instant end;
    private String entityKind;
    private String entityId;
    @Builder.Default
    private List<String> entityIds = List.of();
    private String dataSourceId;
    private Granularity sourceGranularity;
    /** key → beklenen değer; null değer "dimension yok" filtresi. */
    @Builder.Default
    private Map<String, Object> dimensions = Map.of();
}
