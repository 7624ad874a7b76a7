package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.SegmentRequest;
import com.baykanat.metrics.core.api.dto.SegmentResponse;
import com.baykanat.metrics.core.api.dto.SegmentUpdateRequest;
import com.baykanat.metrics.core.domain.exception.ConflictException;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.exception.NotFoundException;
import com.baykanat.metrics.core.domain.mapper.SegmentMapper;
import com.baykanat.metrics.core.domain.model.Segment;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/** Segment tanımlarının CRUD'u; kural kaydedilirken doğrulanır. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentService {

    private final SegmentJdbcRepository segmentRepository;
    private final SegmentMapper segmentMapper;

    public List<SegmentResponse> list(String entityKind, String q, boolean includeInactive) {
        return segmentMapper.toResponses(segmentRepository.list(
                MetricQueryParser.trimToNull(entityKind), MetricQueryParser.trimToNull(q), includeInactive));
    }

    public SegmentResponse get(String key) {
        return segmentMapper.toResponse(require(key));
    }

    public SegmentResponse create(SegmentRequest request) {
        Segment segment = segmentMapper.toSegment(request);
        segment.getRule().validate(segment.getEntityKind());
        segment.setId("seg_" + UUID.randomUUID());
        try {
            segmentRepository.insert(segment);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Segment key already exists");
        }
        log.info("Segment created: key={}, entityKind={}, kind={}",
                segment.getKey(), segment.getEntityKind(), segment.getRule().ruleKind().code());
        return segmentMapper.toResponse(require(segment.getKey()));
    }

    /** Kısmi güncelleme; key ve entityKind sabit. */
    public SegmentResponse update(String key, SegmentUpdateRequest request) {
        if (request == null || request.isEmpty()) {
            throw new MetricsValidationException("No fields to update");
        }
        Segment segment = require(key);
        if (request.getLabel() != null) {
            if (request.getLabel().isBlank()) {
                throw new MetricsValidationException("label must not be blank");
            }
            segment.setLabel(request.getLabel().trim());
        }
        if (request.getDescription() != null) {
            segment.setDescription(request.getDescription());
        }
        if (request.getRule() != null) {
            request.getRule().validate(segment.getEntityKind());
            segment.setRule(request.getRule());
        }
        if (request.getActive() != null) {
            segment.setActive(request.getActive());
        }
        if (segmentRepository.update(segment) == 0) {
            throw new NotFoundException("Segment not found: " + key);
        }
        log.info("Segment updated: key={}", key);
        return segmentMapper.toResponse(require(key));
    }

    public void delete(String key) {
        if (segmentRepository.deleteByKey(key) == 0) {
            throw new NotFoundException("Segment not found: " + key);
        }
        log.info("Segment deleted: key={}", key);
    }

    private Segment require(String key) {
        return segmentRepository.findByKey(key)
                .orElseThrow(() -> new NotFoundException("Segment not found: " + key));
    }
}
