package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Kova başına üye sayfası; bucketPages segmentKey → sayfa numarası. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-bucket member pages of a table column")
public class TableBucketQueryRequest {

    @NotBlank(message = "Missing tableId")
    private String tableId;

    @NotBlank(message = "Missing columnKey")
    private String columnKey;

    @NotBlank(message = "Missing entityKind")
    private String entityKind;

    @Min(value = 1, message = "pageSize must be >= 1")
    @Max(value = 500, message = "pageSize must be <= 500")
    @Schema(description = "Page size per bucket", example = "25")
    private Integer pageSize;

    private Map<String, Integer> bucketPages;
}
