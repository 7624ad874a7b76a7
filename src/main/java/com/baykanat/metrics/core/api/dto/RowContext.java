package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Tıklanan toplama satırının değerleri. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Values of the aggregate row being drilled into")
public class RowContext {

    @Schema(description = "Row bucket start; required when the base query is bucketed", example = "2024-01-01T00:00:00Z")
    private String bucket;

    @Schema(description = "Row entityId; required when the base query groups by entity", example = "proj_42")
    private String entityId;

    @Schema(description = "Row values for every groupBy key", example = "{\"country\": \"TR\"}")
    private Map<String, Object> dimensions;
}
