package com.baykanat.metrics.core.api.controller;

import com.baykanat.metrics.core.api.dto.TableBucketEvaluateRequest;
import com.baykanat.metrics.core.api.dto.TableBucketEvaluateResponse;
import com.baykanat.metrics.core.api.dto.TableBucketListResponse;
import com.baykanat.metrics.core.api.dto.TableBucketQueryRequest;
import com.baykanat.metrics.core.api.dto.TableBucketQueryResponse;
import com.baykanat.metrics.core.domain.service.TableBucketService;
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

/** Tablo kolonlarına bağlı segment kovaları: tanımlar, kova başına üyeler ve ilk eşleşen atama. */
@Slf4j
@RestController
@RequestMapping("/segments/table-buckets")
@RequiredArgsConstructor
@Tag(name = "Table Buckets", description = "Disjoint bucket assignment from ordered segment rules")
public class TableBucketController {

    private final TableBucketService tableBucketService;

    @GetMapping
    @Operation(summary = "List bucket definitions",
            description = "Buckets of one column, or all columns of the table grouped by column when columnKey is omitted")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Bucket definitions in priority order"),
            @ApiResponse(responseCode = "400", description = "Missing tableId")
    })
    public ResponseEntity<TableBucketListResponse> list(
            @Parameter(description = "Table id", required = true, example = "projects")
            @RequestParam("tableId") String tableId,

            @Parameter(description = "Column key", example = "revenue_bucket")
            @RequestParam(value = "columnKey", required = false) String columnKey,

            @Parameter(description = "Entity kind filter", example = "project")
            @RequestParam(value = "entityKind", required = false) String entityKind
    ) {
        return ResponseEntity.ok(tableBucketService.list(tableId, columnKey, entityKind));
    }

    @PostMapping("/query")
    @Operation(summary = "Page members of every bucket", description = "Raw membership per bucket; buckets may overlap here")
    public ResponseEntity<TableBucketQueryResponse> query(@Valid @RequestBody TableBucketQueryRequest request) {
        return ResponseEntity.ok(tableBucketService.query(request));
    }

    @PostMapping("/evaluate")
    @Operation(summary = "Assign entities to buckets",
            description = "Each entity lands in the first bucket (by sortOrder, label, key) whose rule matches; null if none")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "entityId to bucket map"),
            @ApiResponse(responseCode = "400", description = "More than 500 ids or missing fields"),
            @ApiResponse(responseCode = "503", description = "User directory unavailable")
    })
    public ResponseEntity<TableBucketEvaluateResponse> evaluate(@Valid @RequestBody TableBucketEvaluateRequest request) {
        log.debug("Bucket evaluate: tableId={}, columnKey={}, ids={}",
                request.getTableId(), request.getColumnKey(), request.getEntityIds().size());
        return ResponseEntity.ok(new TableBucketEvaluateResponse(tableBucketService.assign(
                request.getTableId().trim(), request.getColumnKey().trim(), request.getEntityKind().trim(),
                request.getEntityIds())));
    }
}
