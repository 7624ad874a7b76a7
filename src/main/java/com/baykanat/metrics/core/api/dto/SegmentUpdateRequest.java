package com.baykanat.metrics.core.api.dto;

import com.baykanat.metrics.core.domain.model.rule.SegmentRule;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Kısmi güncelleme; null alanlar değişmez. key ve entityKind değiştirilemez. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Segment partial update request")
public class SegmentUpdateRequest {

    private String label;
    private String description;
    private SegmentRule rule;

    @JsonProperty("isActive")
    private Boolean active;

    public boolean isEmpty() {
        return label == null && description == null && rule == null && active == null;
    }
}
