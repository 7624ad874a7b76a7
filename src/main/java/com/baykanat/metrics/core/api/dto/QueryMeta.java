package com.baykanat.metrics.core.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/** Çözülmüş sorgu parametreleri. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryMeta {

    private String metricKey;
    private Instant start;
    private Instant end;
    private String bucket;
    private String agg;
    private List<String> groupBy;
    private boolean groupByEntityId;
}
