package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.MetricQueryRequest;
import com.baykanat.metrics.core.api.dto.PointFilterRequest;
import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.Bucket;
import com.baykanat.metrics.core.domain.model.Granularity;
import com.baykanat.metrics.core.domain.model.MetricQuery;
import com.baykanat.metrics.core.domain.model.PointFilter;
import com.baykanat.metrics.core.domain.model.Timestamps;
import com.baykanat.metrics.core.infrastructure.sql.DimensionKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** İstek DTO'larını doğrulanmış MetricQuery / PointFilter'a çevirir; tüm validasyon hataları burada atılır. */
@Component
@RequiredArgsConstructor
public class MetricQueryParser {

    private final AppProperties appProperties;

    public MetricQuery parse(MetricQueryRequest request) {
        if (request == null) {
            throw new MetricsValidationException("Invalid query");
        }
        Bucket bucket = Bucket.fromCode(request.getBucket());
        AggregationFunction agg = AggregationFunction.fromCode(request.getAgg());

        if (!bucket.isNone() && (isBlank(request.getStart()) || isBlank(request.getEnd()))) {
            throw new MetricsValidationException("Missing start/end");
        }
        PointFilter filter = parseFilter(request);

        List<String> groupBy = new ArrayList<>();
        if (request.getGroupBy() != null) {
            groupBy.addAll(new LinkedHashSet<>(request.getGroupBy()));
        }
        DimensionKeys.requireGroupByKeys(groupBy);

        return MetricQuery.builder()
                .filter(filter)
                .bucket(bucket)
                .agg(agg)
                .groupBy(List.copyOf(groupBy))
                .groupByEntityId(Boolean.TRUE.equals(request.getGroupByEntityId()))
                .build();
    }

    /** Toplama olmadan filtre; start/end opsiyonel ama ikisi de varsa end > start. */
    public PointFilter parseFilter(PointFilterRequest request) {
        if (request == null) {
            throw new MetricsValidationException("Invalid point filter");
        }
        String metricKey = trimToNull(request.getMetricKey());
        if (metricKey == null) {
            throw new MetricsValidationException("Missing metricKey");
        }

        Instant start = Timestamps.parseOptional("start", request.getStart());
        Instant end = Timestamps.parseOptional("end", request.getEnd());
        Timestamps.requireOrdered("end", "start", start, end);

        List<String> entityIds = request.getEntityIds() == null ? List.of() : request.getEntityIds().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .toList();
        int maxEntityIds = appProperties.getQuery().getMaxEntityIds();
        if (entityIds.size() > maxEntityIds) {
            throw new MetricsValidationException("Too many entityIds (max " + maxEntityIds + ")");
        }

        Granularity granularity = null;
        String rawGranularity = trimToNull(request.getSourceGranularity());
        if (rawGranularity != null) {
            granularity = Granularity.parse(rawGranularity)
                    .orElseThrow(() -> new MetricsValidationException("Invalid sourceGranularity: " + rawGranularity));
        }

        Map<String, Object> dimensions = new LinkedHashMap<>();
        if (request.getDimensions() != null) {
            request.getDimensions().forEach((key, value) -> {
                DimensionKeys.requireValid(key);
                dimensions.put(key, value);
            });
        }

        return PointFilter.builder()
                .metricKey(metricKey)
                .start(start)
                .end(end)
                .entityKind(trimToNull(request.getEntityKind()))
                .entityId(trimToNull(request.getEntityId()))
                .entityIds(entityIds)
                .dataSourceId(trimToNull(request.getDataSourceId()))
                .sourceGranularity(granularity)
                .dimensions(dimensions)
                .build();
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
