package com.baykanat.metrics.core.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/** entityId → kolon değeri; değeri olmayan id map'te yer almaz. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableMetricEvaluateResponse {

    private Map<String, BigDecimal> values;
}
