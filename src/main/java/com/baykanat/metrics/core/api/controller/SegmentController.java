package com.baykanat.metrics.core.api.controller;

import com.baykanat.metrics.core.api.dto.SegmentEvaluateRequest;
import com.baykanat.metrics.core.api.dto.SegmentMembersRequest;
import com.baykanat.metrics.core.api.dto.SegmentMembersResponse;
import com.baykanat.metrics.core.api.dto.SegmentRequest;
import com.baykanat.metrics.core.api.dto.SegmentResponse;
import com.baykanat.metrics.core.api.dto.SegmentUpdateRequest;
import com.baykanat.metrics.core.domain.model.MembersPage;
import com.baykanat.metrics.core.domain.model.SegmentEvaluation;
import com.baykanat.metrics.core.domain.service.SegmentRuleEvaluator;
import com.baykanat.metrics.core.domain.service.SegmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Segment tanımları, tek entity değerlendirme ve sayfalı üye listesi. */
@Slf4j
@RestController
@RequestMapping("/segments")
@RequiredArgsConstructor
@Tag(name = "Segments", description = "Segment definitions and membership evaluation")
public class SegmentController {

    private static final int DEFAULT_PAGE_SIZE = 50;

    private final SegmentService segmentService;
    private final SegmentRuleEvaluator segmentRuleEvaluator;

    @GetMapping
    @Operation(summary = "List segments", description = "Ordered by key; inactive segments are hidden unless requested")
    public ResponseEntity<List<SegmentResponse>> list(
            @Parameter(description = "Entity kind filter", example = "user")
            @RequestParam(value = "entityKind", required = false) String entityKind,

            @Parameter(description = "Case-insensitive substring of key, label or description")
            @RequestParam(value = "q", required = false) String q,

            @Parameter(description = "Include inactive segments")
            @RequestParam(value = "includeInactive", required = false, defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(segmentService.list(entityKind, q, includeInactive));
    }

    @PostMapping
    @Operation(summary = "Create a segment")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Segment created"),
            @ApiResponse(responseCode = "400", description = "Invalid rule or missing fields"),
            @ApiResponse(responseCode = "409", description = "Segment key already exists")
    })
    public ResponseEntity<SegmentResponse> create(@Valid @RequestBody SegmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(segmentService.create(request));
    }

    @GetMapping("/{key}")
    @Operation(summary = "Get a segment by key")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segment found"),
            @ApiResponse(responseCode = "404", description = "Unknown segment key")
    })
    public ResponseEntity<SegmentResponse> get(@PathVariable("key") String key) {
        return ResponseEntity.ok(segmentService.get(key));
    }

    @PutMapping("/{key}")
    @Operation(summary = "Partially update a segment", description = "key and entityKind cannot change")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Segment updated"),
            @ApiResponse(responseCode = "400", description = "No fields to update or invalid rule"),
            @ApiResponse(responseCode = "404", description = "Unknown segment key")
    })
    public ResponseEntity<SegmentResponse> update(@PathVariable("key") String key,
                                                  @RequestBody SegmentUpdateRequest request) {
        return ResponseEntity.ok(segmentService.update(key, request));
    }

    @DeleteMapping("/{key}")
    @Operation(summary = "Delete a segment")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Segment deleted"),
            @ApiResponse(responseCode = "404", description = "Unknown segment key")
    })
    public ResponseEntity<Void> delete(@PathVariable("key") String key) {
        segmentService.delete(key);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/evaluate")
    @Operation(summary = "Check one entity's membership",
            description = "value is set for metric_threshold rules; inactive segments never match")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Membership result"),
            @ApiResponse(responseCode = "400", description = "entityKind mismatch or unsupported rule"),
            @ApiResponse(responseCode = "404", description = "Unknown segment key"),
            @ApiResponse(responseCode = "503", description = "User directory unavailable")
    })
    public ResponseEntity<SegmentEvaluation> evaluate(@Valid @RequestBody SegmentEvaluateRequest request) {
        log.debug("Evaluate segment: key={}, entityKind={}", request.getSegmentKey(), request.getEntityKind());
        return ResponseEntity.ok(segmentRuleEvaluator.evaluate(
                request.getSegmentKey().trim(), request.getEntityKind().trim(), request.getEntityId()));
    }

    @PostMapping("/query")
    @Operation(summary = "List matching entity ids", description = "Ascending entity id order, paged")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of matching ids with total"),
            @ApiResponse(responseCode = "400", description = "Invalid paging or rule"),
            @ApiResponse(responseCode = "404", description = "Unknown segment key")
    })
    public ResponseEntity<SegmentMembersResponse> members(@Valid @RequestBody SegmentMembersRequest request) {
        int page = request.getPage() != null ? request.getPage() : 1;
        int pageSize = request.getPageSize() != null ? request.getPageSize() : DEFAULT_PAGE_SIZE;
        MembersPage members = segmentRuleEvaluator.members(
                request.getSegmentKey().trim(), request.getEntityKind().trim(), page, pageSize);
        return ResponseEntity.ok(SegmentMembersResponse.builder()
                .items(members.getItems())
                .total(members.getTotal())
                .page(page)
                .pageSize(pageSize)
                .build());
    }
}
