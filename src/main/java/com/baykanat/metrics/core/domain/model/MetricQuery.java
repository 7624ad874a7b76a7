package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Doğrulanmış toplama sorgusu. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricQuery {

    private PointFilter filter;
    private Bucket bucket;
    private AggregationFunction agg;
    @Builder.Default
    private List<String> groupBy = List.of();
    private boolean groupByEntityId;
}
