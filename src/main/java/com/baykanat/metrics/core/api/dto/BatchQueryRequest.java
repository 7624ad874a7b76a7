package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** En fazla 200 bağımsız sorgu; sınır servis katmanında (config'ten) kontrol edilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Batch of independent aggregation queries")
public class BatchQueryRequest {

    @NotEmpty(message = "queries must not be empty")
    private List<MetricQueryRequest> queries;
}
