package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Toplu point ingest isteği. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Bulk metric point ingestion payload")
public class IngestPointsRequest {

    @NotNull(message = "Body must include points: []")
    @Schema(description = "Points to upsert; malformed entries are dropped")
    private List<MetricPointRequest> points;
}
