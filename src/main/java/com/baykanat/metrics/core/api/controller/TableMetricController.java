package com.baykanat.metrics.core.api.controller;

import com.baykanat.metrics.core.api.dto.TableMetricEvaluateRequest;
import com.baykanat.metrics.core.api.dto.TableMetricEvaluateResponse;
import com.baykanat.metrics.core.api.dto.TableMetricListResponse;
import com.baykanat.metrics.core.domain.service.TableMetricService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Tablo kolonu olarak gösterilen entity başına metrik değerleri. */
@Slf4j
@RestController
@RequestMapping("/segments/table-metrics")
@RequiredArgsConstructor
@Tag(name = "Table Metrics", description = "Per-entity metric values for computed table columns")
public class TableMetricController {

    private final TableMetricService tableMetricService;

    @GetMapping
    @Operation(summary = "List metric columns", description = "Metric columns of a table ordered by sortOrder, label, key")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Column definitions"),
            @ApiResponse(responseCode = "400", description = "Missing tableId")
    })
    public ResponseEntity<TableMetricListResponse> list(
            @Parameter(description = "Table id", required = true, example = "projects")
            @RequestParam("tableId") String tableId,

            @Parameter(description = "Entity kind filter", example = "project")
            @RequestParam(value = "entityKind", required = false) String entityKind
    ) {
        return ResponseEntity.ok(tableMetricService.list(tableId, entityKind));
    }

    @PostMapping("/evaluate")
    @Operation(summary = "Compute column values",
            description = "Aggregates the column metric per entity over its window; sum and count default to 0")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "entityId to value map"),
            @ApiResponse(responseCode = "400", description = "More than 500 ids or missing fields"),
            @ApiResponse(responseCode = "404", description = "Unknown metric column")
    })
    public ResponseEntity<TableMetricEvaluateResponse> evaluate(@Valid @RequestBody TableMetricEvaluateRequest request) {
        log.debug("Table metric evaluate: tableId={}, columnKey={}, ids={}",
                request.getTableId(), request.getColumnKey(), request.getEntityIds().size());
        return ResponseEntity.ok(new TableMetricEvaluateResponse(tableMetricService.evaluate(
                request.getTableId().trim(), request.getColumnKey().trim(), request.getEntityKind().trim(),
                request.getEntityIds())));
    }
}
