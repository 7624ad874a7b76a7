package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** received - ingested = atlanan bozuk point sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ingestion result")
public class IngestPointsResponse {

    @Schema(description = "Number of points in the request", example = "120")
    private int received;

    @Schema(description = "Number of well-formed points upserted", example = "118")
    private int ingested;
}
