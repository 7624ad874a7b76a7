package com.baykanat.metrics.core.api.dto;

import com.baykanat.metrics.core.domain.model.rule.SegmentRule;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Segment oluşturma isteği; isActive boşsa true. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Segment create request")
public class SegmentRequest {

    @NotBlank(message = "Missing key")
    @Schema(description = "Unique segment key", example = "high_revenue_projects")
    private String key;

    @NotBlank(message = "Missing entityKind")
    @Schema(description = "Entity kind the rule classifies", example = "project")
    private String entityKind;

    @NotBlank(message = "Missing label")
    @Schema(description = "Display label", example = "High revenue")
    private String label;

    private String description;

    @NotNull(message = "Missing rule")
    @Schema(description = "Rule object; the kind field selects the variant")
    private SegmentRule rule;

    @JsonProperty("isActive")
    private Boolean active;
}
