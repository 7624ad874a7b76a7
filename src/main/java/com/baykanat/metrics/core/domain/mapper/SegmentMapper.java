package com.baykanat.metrics.core.domain.mapper;

import com.baykanat.metrics.core.api.dto.SegmentRequest;
import com.baykanat.metrics.core.api.dto.SegmentResponse;
import com.baykanat.metrics.core.domain.model.Segment;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/** SegmentRequest → Segment → SegmentResponse. */
@Mapper(componentModel = "spring")
public interface SegmentMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "key", expression = "java(request.getKey().trim())")
    @Mapping(target = "entityKind", expression = "java(request.getEntityKind().trim())")
    @Mapping(target = "label", expression = "java(request.getLabel().trim())")
    @Mapping(target = "active", source = "active", defaultValue = "true")
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    Segment toSegment(SegmentRequest request);

    SegmentResponse toResponse(Segment segment);

    List<SegmentResponse> toResponses(List<Segment> segments);
}
