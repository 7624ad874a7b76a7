package com.baykanat.metrics.core.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceResponse {

    private String id;
    private String entityKind;
    private String entityId;
    private String connectorKey;
    private String sourceKind;
    private String externalRef;
    private boolean enabled;
    private Instant createdAt;
    private Instant updatedAt;
}
