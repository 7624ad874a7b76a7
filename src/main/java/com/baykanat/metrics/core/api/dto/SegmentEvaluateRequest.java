package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Single entity membership check")
public class SegmentEvaluateRequest {

    @NotBlank(message = "Missing segmentKey")
    private String segmentKey;

    @NotBlank(message = "Missing entityKind")
    private String entityKind;

    @NotBlank(message = "Missing entityId")
    private String entityId;
}
