package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Satırlar: bucket?, entityId?, groupBy key'leri, value. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregation query result")
public class QueryResponse {

    @Schema(description = "Rows ordered by bucket, entityId, then groupBy keys",
            example = "[{\"bucket\": \"2024-01-01T00:00:00Z\", \"country\": \"TR\", \"value\": 15}]")
    private List<Map<String, Object>> data;

    private QueryMeta meta;
}
