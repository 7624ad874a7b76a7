package com.baykanat.metrics.core.domain.model;

import com.baykanat.metrics.core.domain.model.rule.SegmentRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** metrics_segments satırı; rule JSONB'den tipli kurala çevrilmiş hali. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Segment {

    private String id;
    private String key;
    private String entityKind;
    private String label;
    private String description;
    private SegmentRule rule;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;
}
