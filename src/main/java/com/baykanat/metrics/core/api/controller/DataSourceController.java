package com.baykanat.metrics.core.api.controller;

import com.baykanat.metrics.core.api.dto.DataSourceRequest;
import com.baykanat.metrics.core.api.dto.DataSourceResponse;
import com.baykanat.metrics.core.domain.service.DataSourceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Point provenance kaynakları; zamanlama yok, sadece kayıt. */
@RestController
@RequestMapping("/data-sources")
@RequiredArgsConstructor
@Tag(name = "Data Sources", description = "Registry of point provenance sources")
public class DataSourceController {

    private final DataSourceService dataSourceService;

    @PostMapping
    @Operation(summary = "Register a data source")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Data source created"),
            @ApiResponse(responseCode = "400", description = "Missing required fields"),
            @ApiResponse(responseCode = "409", description = "Id already exists")
    })
    public ResponseEntity<DataSourceResponse> create(@Valid @RequestBody DataSourceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(dataSourceService.create(request));
    }

    @GetMapping
    @Operation(summary = "List data sources")
    public ResponseEntity<List<DataSourceResponse>> list(
            @Parameter(description = "Entity kind filter", example = "project")
            @RequestParam(value = "entityKind", required = false) String entityKind,

            @Parameter(description = "Entity id filter")
            @RequestParam(value = "entityId", required = false) String entityId
    ) {
        return ResponseEntity.ok(dataSourceService.list(entityKind, entityId));
    }
}
