package com.baykanat.metrics.core.api.controller;

import com.baykanat.metrics.core.api.dto.IngestPointsRequest;
import com.baykanat.metrics.core.api.dto.IngestPointsResponse;
import com.baykanat.metrics.core.domain.service.PointIngestionService;
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

/** POST /points/ingest: senkron idempotent upsert; bozuk point'ler atlanır. */
@Slf4j
@RestController
@RequestMapping("/points")
@RequiredArgsConstructor
@Tag(name = "Point Ingestion", description = "Idempotent upsert of metric points")
public class IngestController {

    private final PointIngestionService ingestionService;

    @PostMapping("/ingest")
    @Operation(summary = "Upsert metric points",
            description = "Malformed points are dropped; compare ingested against received to detect them")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Points upserted"),
            @ApiResponse(responseCode = "400", description = "No valid points provided"),
            @ApiResponse(responseCode = "503", description = "Storage temporarily unavailable, safe to retry")
    })
    public ResponseEntity<IngestPointsResponse> ingest(@Valid @RequestBody IngestPointsRequest request) {
        log.debug("Received ingest request with {} points", request.getPoints().size());
        return ResponseEntity.ok(ingestionService.ingest(request.getPoints()));
    }
}
