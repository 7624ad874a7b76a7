package com.baykanat.metrics.core.domain.mapper;

import com.baykanat.metrics.core.api.dto.MetricPointRequest;
import com.baykanat.metrics.core.api.dto.MetricPointResponse;
import com.baykanat.metrics.core.domain.model.Granularity;
import com.baykanat.metrics.core.domain.model.MetricPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/** MetricPointRequest ↔ MetricPoint ↔ MetricPointResponse ve Kafka record value dönüşümleri. JSONB için Jackson. */
@Mapper(componentModel = "spring")
public interface MetricPointMapper {

    /** JSONB alanları için paylaşılan ObjectMapper. */
    ObjectMapper JSON_MAPPER = new ObjectMapper();

    TypeReference<Map<String, Object>> DIMENSIONS_TYPE = new TypeReference<>() {
    };

    /** Servis katmanında parse edilmiş alanlarla (date, granularity, value, hash) domain point üretir. */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "entityKind", source = "request.entityKind")
    @Mapping(target = "entityId", source = "request.entityId")
    @Mapping(target = "metricKey", source = "request.metricKey")
    @Mapping(target = "dataSourceId", source = "request.dataSourceId")
    @Mapping(target = "syncRunId", source = "request.syncRunId", qualifiedByName = "blankToNull")
    @Mapping(target = "ingestBatchId", source = "request.ingestBatchId", qualifiedByName = "blankToNull")
    @Mapping(target = "date", source = "date")
    @Mapping(target = "granularity", source = "granularity")
    @Mapping(target = "value", source = "value")
    @Mapping(target = "dimensions", source = "request.dimensions", qualifiedByName = "toJsonString")
    @Mapping(target = "dimensionsHash", source = "dimensionsHash")
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    MetricPoint toMetricPoint(MetricPointRequest request, Instant date, Granularity granularity,
                              BigDecimal value, String dimensionsHash);

    @Mapping(target = "granularity", source = "granularity", qualifiedByName = "granularityCode")
    @Mapping(target = "dimensions", source = "dimensions", qualifiedByName = "fromJsonString")
    MetricPointResponse toResponse(MetricPoint point);

    /** Kafka value MetricPointRequest ise döner, değilse Map vb. üzerinden çevirir. */
    default MetricPointRequest fromRecordValue(Object value) {
        if (value instanceof MetricPointRequest request) {
            return request;
        }
        return JSON_MAPPER.convertValue(value, MetricPointRequest.class);
    }

    @Named("blankToNull")
    default String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @Named("granularityCode")
    default String granularityCode(Granularity granularity) {
        return granularity == null ? null : granularity.code();
    }

    /** Map → JSON string (dimensions JSONB için). */
    @Named("toJsonString")
    default String toJsonString(Map<String, Object> dimensions) {
        if (dimensions == null) return null;
        try {
            return JSON_MAPPER.writeValueAsString(dimensions);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Dimensions are not serializable", e);
        }
    }

    /** JSONB string → Map. */
    @Named("fromJsonString")
    default Map<String, Object> fromJsonString(String json) {
        if (json == null) return null;
        try {
            return JSON_MAPPER.readValue(json, DIMENSIONS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored dimensions are not valid JSON", e);
        }
    }
}
