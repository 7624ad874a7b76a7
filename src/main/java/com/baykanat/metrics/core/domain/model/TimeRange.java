package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/** Yarı açık aralık [start, end); null uç sınırsız demek. */
@Data
@AllArgsConstructor
public class TimeRange {

    private Instant start;
    private Instant end;

    public static TimeRange unbounded() {
        return new TimeRange(null, null);
    }
}
