package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;
import java.util.Map;

/** Ham point filtresi; sorgu ve drilldown ortak kelime dağarcığı. Alanlar String, parse servis katmanında. */
@Data
@SuperBuilder
@NoArgsConstructor
@Schema(description = "Raw point filter")
public class PointFilterRequest {

    @Schema(description = "Metric key", example = "revenue_gross", requiredMode = Schema.RequiredMode.REQUIRED)
    private String metricKey;

    @Schema(description = "Inclusive range start (ISO-8601 or yyyy-MM-dd)", example = "2024-01-01")
    private String start;

    @Schema(description = "Exclusive range end (ISO-8601 or yyyy-MM-dd)", example = "2024-02-01")
    private String end;

    @Schema(example = "project")
    private String entityKind;

    @Schema(example = "proj_42")
    private String entityId;

    @Schema(description = "At most 1000 entity ids")
    private List<String> entityIds;

    @Schema(example = "ds_steam_sales")
    private String dataSourceId;

    @Schema(description = "Stored granularity of the source points", example = "daily")
    private String sourceGranularity;

    @Schema(description = "Dimension equality filters; null matches points without the dimension",
            example = "{\"country\": \"TR\"}")
    private Map<String, Object> dimensions;
}
