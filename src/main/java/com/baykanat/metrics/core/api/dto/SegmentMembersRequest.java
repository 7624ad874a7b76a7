package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Segment üyelerinin sayfalı listesi; page 1, pageSize 50 varsayılan. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Paged segment member listing")
public class SegmentMembersRequest {

    @NotBlank(message = "Missing segmentKey")
    private String segmentKey;

    @NotBlank(message = "Missing entityKind")
    private String entityKind;

    @Min(value = 1, message = "page must be >= 1")
    private Integer page;

    @Min(value = 1, message = "pageSize must be >= 1")
    @Max(value = 500, message = "pageSize must be <= 500")
    private Integer pageSize;
}
