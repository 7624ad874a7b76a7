package com.baykanat.metrics.core.api.dto;

import com.baykanat.metrics.core.domain.model.rule.SegmentRule;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentResponse {

    private String id;
    private String key;
    private String entityKind;
    private String label;
    private String description;
    private SegmentRule rule;

    @JsonProperty("isActive")
    private boolean active;

    private Instant createdAt;
    private Instant updatedAt;
}
