package com.baykanat.metrics.core.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Assign each entity to the first matching bucket of a table column")
public class TableBucketEvaluateRequest {

    @NotBlank(message = "Missing tableId")
    private String tableId;

    @NotBlank(message = "Missing columnKey")
    private String columnKey;

    @NotBlank(message = "Missing entityKind")
    private String entityKind;

    @NotNull(message = "Missing entityIds")
    @Size(max = 500, message = "Too many entityIds (max 500)")
    private List<String> entityIds;
}
