package com.baykanat.metrics.core.infrastructure.sql;

import com.baykanat.metrics.core.domain.model.AggregationFunction;

/** agg enum'undan SQL toplama ifadesi; sorgu motoru, segment değerlendirici ve contributor sorguları ortak kullanır. */
public final class AggregationSql {

    private AggregationSql() {
    }

    /**
     * @throws IllegalArgumentException agg=last için; o yol {@link LatestPointSql} üzerinden gider
     */
    public static String expression(AggregationFunction agg) {
        return switch (agg) {
            case SUM -> "SUM(value)";
            case AVG -> "AVG(value)";
            case MIN -> "MIN(value)";
            case MAX -> "MAX(value)";
            case COUNT -> "COUNT(*)";
            case LAST -> throw new IllegalArgumentException("agg=last has no plain aggregate expression");
        };
    }
}
