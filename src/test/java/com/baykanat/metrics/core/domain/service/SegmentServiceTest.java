package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.SegmentRequest;
import com.baykanat.metrics.core.api.dto.SegmentResponse;
import com.baykanat.metrics.core.api.dto.SegmentUpdateRequest;
import com.baykanat.metrics.core.domain.exception.ConflictException;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.exception.NotFoundException;
import com.baykanat.metrics.core.domain.exception.UnsupportedCombinationException;
import com.baykanat.metrics.core.domain.mapper.SegmentMapper;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.ComparisonOp;
import com.baykanat.metrics.core.domain.model.Segment;
import com.baykanat.metrics.core.domain.model.rule.AllEntitiesRule;
import com.baykanat.metrics.core.domain.model.rule.MetricThresholdRule;
import com.baykanat.metrics.core.domain.model.rule.SegmentRule;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SegmentServiceTest {

    @Mock
    private SegmentJdbcRepository segmentRepository;

    private SegmentService service;

    @BeforeEach
    void setUp() {
        service = new SegmentService(segmentRepository, Mappers.getMapper(SegmentMapper.class));
    }

    @Test
    @DisplayName("Create - trims fields, defaults isActive to true and returns the stored segment")
    void create() {
        when(segmentRepository.findByKey("big")).thenReturn(Optional.of(Segment.builder()
                .id("seg_1").key("big").entityKind("project").label("Big projects")
                .rule(threshold()).active(true).build()));

        SegmentResponse response = service.create(request(" big ", "project", threshold()));

        ArgumentCaptor<Segment> captor = ArgumentCaptor.forClass(Segment.class);
        verify(segmentRepository).insert(captor.capture());
        Segment stored = captor.getValue();
        assertThat(stored.getId()).startsWith("seg_");
        assertThat(stored.getKey()).isEqualTo("big");
        assertThat(stored.isActive()).isTrue();
        assertThat(response.getKey()).isEqualTo("big");
        assertThat(response.isActive()).isTrue();
    }

    @Test
    @DisplayName("Create - rule is validated against the entityKind before saving")
    void createValidatesRule() {
        SegmentRequest request = request("everyone", "project", new AllEntitiesRule());

        assertThatThrownBy(() -> service.create(request)).isInstanceOf(UnsupportedCombinationException.class);
        verify(segmentRepository, never()).insert(any());
    }

    @Test
    @DisplayName("Create - duplicate key is a conflict")
    void createDuplicate() {
        doThrow(new DuplicateKeyException("uq")).when(segmentRepository).insert(any(Segment.class));

        assertThatThrownBy(() -> service.create(request("big", "project", threshold())))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Segment key already exists");
    }

    @Test
    @DisplayName("Update - empty body is rejected")
    void updateEmpty() {
        assertThatThrownBy(() -> service.update("big", new SegmentUpdateRequest()))
                .isInstanceOf(MetricsValidationException.class)
                .hasMessage("No fields to update");
        verifyNoInteractions(segmentRepository);
    }

    @Test
    @DisplayName("Update - only provided fields change")
    void updatePartial() {
        Segment existing = Segment.builder().id("seg_1").key("big").entityKind("project").label("Big")
                .description("old").rule(threshold()).active(true).build();
        when(segmentRepository.findByKey("big")).thenReturn(Optional.of(existing));
        when(segmentRepository.update(any(Segment.class))).thenReturn(1);

        SegmentUpdateRequest request = new SegmentUpdateRequest();
        request.setActive(false);
        service.update("big", request);

        ArgumentCaptor<Segment> captor = ArgumentCaptor.forClass(Segment.class);
        verify(segmentRepository).update(captor.capture());
        assertThat(captor.getValue().isActive()).isFalse();
        assertThat(captor.getValue().getLabel()).isEqualTo("Big");
        assertThat(captor.getValue().getDescription()).isEqualTo("old");
    }

    @Test
    @DisplayName("Delete - unknown key is not found")
    void deleteMissing() {
        when(segmentRepository.deleteByKey("nope")).thenReturn(0);

        assertThatThrownBy(() -> service.delete("nope")).isInstanceOf(NotFoundException.class);
    }

    private static SegmentRequest request(String key, String entityKind,
                                          SegmentRule rule) {
        return SegmentRequest.builder().key(key).entityKind(entityKind).label("Big projects").rule(rule).build();
    }

    private static MetricThresholdRule threshold() {
        return MetricThresholdRule.builder()
                .metricKey("revenue")
                .agg(AggregationFunction.SUM)
                .op(ComparisonOp.GTE)
                .value(new BigDecimal("1000"))
                .build();
    }
}
