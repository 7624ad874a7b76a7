package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Point provenance kaydı; id verilmezse üretilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Data source registration")
public class DataSourceRequest {

    @Schema(description = "Optional id; generated when absent", example = "ds_steam")
    private String id;

    @NotBlank(message = "Missing entityKind")
    private String entityKind;

    @NotBlank(message = "Missing entityId")
    private String entityId;

    @NotBlank(message = "Missing connectorKey")
    @Schema(example = "steam")
    private String connectorKey;

    @NotBlank(message = "Missing sourceKind")
    @Schema(example = "api")
    private String sourceKind;

    private String externalRef;
}
