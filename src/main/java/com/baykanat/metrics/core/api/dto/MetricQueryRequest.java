package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

/** Toplama sorgusu; batch modda her sorgunun hatası kendi slotunda kalsın diye enum alanlar da String. */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@Schema(description = "Aggregation query")
public class MetricQueryRequest extends PointFilterRequest {

    @Schema(description = "none, hour, day, week or month; defaults to day", example = "day")
    private String bucket;

    @Schema(description = "sum, avg, min, max, count or last; defaults to sum", example = "sum")
    private String agg;

    @Schema(description = "Dimension keys to group by", example = "[\"country\"]")
    private List<String> groupBy;

    @Schema(description = "Group by entityId as well")
    private Boolean groupByEntityId;
}
