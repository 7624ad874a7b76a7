package com.baykanat.metrics.core.api.controller;

import com.baykanat.metrics.core.api.dto.DrilldownRequest;
import com.baykanat.metrics.core.api.dto.DrilldownResponse;
import com.baykanat.metrics.core.domain.service.DrilldownService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/drilldown")
@RequiredArgsConstructor
@Tag(name = "Drilldown", description = "Raw points behind an aggregate row")
public class DrilldownController {

    private final DrilldownService drilldownService;

    @PostMapping
    @Operation(summary = "Page raw points", description = "Accepts a point filter, or an aggregate query plus the clicked row")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Paged points with optional contributor breakdowns"),
            @ApiResponse(responseCode = "400", description = "Invalid filter or row context")
    })
    public ResponseEntity<DrilldownResponse> drilldown(@Valid @RequestBody DrilldownRequest request) {
        return ResponseEntity.ok(drilldownService.drilldown(request));
    }
}
