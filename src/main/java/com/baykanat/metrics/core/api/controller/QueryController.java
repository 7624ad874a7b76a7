package com.baykanat.metrics.core.api.controller;

import com.baykanat.metrics.core.api.dto.BatchQueryRequest;
import com.baykanat.metrics.core.api.dto.BatchQueryResponse;
import com.baykanat.metrics.core.api.dto.MetricQueryRequest;
import com.baykanat.metrics.core.api.dto.QueryResponse;
import com.baykanat.metrics.core.domain.service.MetricQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /query ve POST /query/batch. */
@Slf4j
@RestController
@RequestMapping("/query")
@RequiredArgsConstructor
@Tag(name = "Query", description = "Aggregation queries over metric points")
public class QueryController {

    private final MetricQueryService queryService;

    @PostMapping
    @Operation(summary = "Run one aggregation query",
            description = "Buckets points by time (or none), aggregates with sum/avg/min/max/count/last and groups by dimensions")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Aggregated rows"),
            @ApiResponse(responseCode = "400", description = "Invalid query")
    })
    public ResponseEntity<QueryResponse> query(@RequestBody MetricQueryRequest request) {
        log.debug("Query: metricKey={}, bucket={}, agg={}", request.getMetricKey(), request.getBucket(), request.getAgg());
        return ResponseEntity.ok(queryService.query(request));
    }

    /** Bir sorgunun hatası sadece kendi slotuna yazılır. */
    @PostMapping("/batch")
    @Operation(summary = "Run up to 200 independent queries",
            description = "Results are returned in input order; a failing query only fails its own slot")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "One result slot per query"),
            @ApiResponse(responseCode = "400", description = "Empty or oversized batch")
    })
    public ResponseEntity<BatchQueryResponse> queryBatch(@Valid @RequestBody BatchQueryRequest request) {
        log.debug("Batch query with {} queries", request.getQueries().size());
        return ResponseEntity.ok(queryService.queryBatch(request.getQueries()));
    }
}
