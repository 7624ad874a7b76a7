package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/** Drilldown sayfasındaki ham point. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Stored metric point")
public class MetricPointResponse {

    private String id;
    private String entityKind;
    private String entityId;
    private String metricKey;
    private String dataSourceId;
    private String syncRunId;
    private String ingestBatchId;

    @Schema(description = "Bucket start (UTC)", example = "2024-01-01T00:00:00Z")
    private Instant date;

    @Schema(example = "daily")
    private String granularity;

    private BigDecimal value;
    private Map<String, Object> dimensions;
}
