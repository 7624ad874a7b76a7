package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/** Toplama sonucu satırı; dimensions groupBy sırasında. */
@Data
@AllArgsConstructor
public class AggregateRow {

    private Instant bucket;
    private String entityId;
    private Map<String, String> dimensions;
    private BigDecimal value;
}
