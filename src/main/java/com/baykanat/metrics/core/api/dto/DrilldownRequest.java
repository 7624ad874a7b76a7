package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Ya pointFilter ya da baseQuery + rowContext. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Drilldown request")
public class DrilldownRequest {

    @Schema(description = "Direct raw point filter")
    private PointFilterRequest pointFilter;

    @Schema(description = "Aggregate query the row came from")
    private MetricQueryRequest baseQuery;

    @Schema(description = "Values of the clicked aggregate row")
    private RowContext rowContext;

    @Min(value = 1, message = "page must be >= 1")
    @Schema(description = "1-based page number", example = "1")
    private Integer page;

    @Min(value = 1, message = "pageSize must be >= 1")
    @Schema(description = "Page size (1..500)", example = "50")
    private Integer pageSize;

    @Schema(description = "Include contributor breakdowns; defaults to true")
    private Boolean includeContributors;
}
