package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Ingest edilen ham point; alanlar bilerek doğrulanmaz, bozuk point servis katmanında atlanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Metric point payload for ingestion")
public class MetricPointRequest {

    @Schema(description = "Entity kind tag", example = "project")
    private String entityKind;

    @Schema(description = "Entity identifier", example = "proj_42")
    private String entityId;

    @Schema(description = "Metric key", example = "revenue_gross")
    private String metricKey;

    @Schema(description = "Owning data source id", example = "ds_steam_sales")
    private String dataSourceId;

    @Schema(description = "Sync run that produced the point", example = "sr_2024_01_01")
    private String syncRunId;

    @Schema(description = "Ingest batch that produced the point", example = "ib_001")
    private String ingestBatchId;

    @Schema(description = "Bucket start as ISO-8601 instant or yyyy-MM-dd", example = "2024-01-01")
    private String date;

    @Schema(description = "Source granularity (hourly, daily, weekly, monthly); defaults to daily", example = "daily")
    private String granularity;

    @Schema(description = "Decimal value (number or numeric string)", example = "129.99")
    private String value;

    @Schema(description = "Scalar dimensions", example = "{\"country\": \"TR\", \"platform\": \"steam\"}")
    private Map<String, Object> dimensions;
}
