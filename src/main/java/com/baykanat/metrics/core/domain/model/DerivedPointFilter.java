package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/** Toplama satırından türetilen filtre ve türetildiği sorgunun özeti. */
@Data
@AllArgsConstructor
public class DerivedPointFilter {

    private PointFilter filter;
    private MetricQuery baseQuery;
    private String rowBucket;
}
