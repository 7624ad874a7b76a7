package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.MetricQueryRequest;
import com.baykanat.metrics.core.api.dto.RowContext;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.model.Bucket;
import com.baykanat.metrics.core.domain.model.DerivedPointFilter;
import com.baykanat.metrics.core.domain.model.MetricQuery;
import com.baykanat.metrics.core.domain.model.PointFilter;
import com.baykanat.metrics.core.domain.model.Timestamps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Toplama sorgusu + satır değerlerinden ham point filtresi türetir: zaman tek kova genişliğine daralır,
 * entity ve groupBy dimension'ları satırdaki değere sabitlenir. Eksik bağlam wildcard değil, hatadır.
 */
@Component
@RequiredArgsConstructor
public class DrilldownFilterResolver {

    private final MetricQueryParser queryParser;

    public DerivedPointFilter derive(MetricQueryRequest baseRequest, RowContext row) {
        MetricQuery base = queryParser.parse(baseRequest);
        PointFilter baseFilter = base.getFilter();
        PointFilter.PointFilterBuilder filter = baseFilter.toBuilder();

        String rowBucket = MetricQueryParser.trimToNull(row.getBucket());
        Bucket bucket = base.getBucket();
        if (!bucket.isNone()) {
            if (rowBucket == null) {
                throw new MetricsValidationException("Missing rowContext.bucket for bucketed drilldown");
            }
            Instant windowStart = Timestamps.tryParse(rowBucket)
                    .orElseThrow(() -> new MetricsValidationException("Invalid rowContext.bucket"));
            Instant windowEnd = bucket.endOf(windowStart);

            // Kova penceresi sorgu aralığıyla kesişir (ilk/son kova kısmi olabilir)
            Instant start = later(windowStart, baseFilter.getStart());
            Instant end = earlier(windowEnd, baseFilter.getEnd());
            if (!end.isAfter(start)) {
                throw new MetricsValidationException("rowContext.bucket is outside the query range");
            }
            filter.start(start).end(end);
        }

        if (base.isGroupByEntityId()) {
            String entityId = MetricQueryParser.trimToNull(row.getEntityId());
            if (entityId == null) {
                throw new MetricsValidationException("Missing rowContext.entityId for groupByEntityId drilldown");
            }
            filter.entityId(entityId);
        }

        Map<String, Object> dimensions = new LinkedHashMap<>(baseFilter.getDimensions());
        if (!base.getGroupBy().isEmpty()) {
            Map<String, Object> rowDimensions = row.getDimensions();
            if (rowDimensions == null) {
                throw new MetricsValidationException("Missing rowContext.dimensions for groupBy drilldown");
            }
            for (String key : base.getGroupBy()) {
                if (!rowDimensions.containsKey(key)) {
                    throw new MetricsValidationException("rowContext.dimensions missing groupBy key: " + key);
                }
                dimensions.put(key, rowDimensions.get(key));
            }
        }
        filter.dimensions(dimensions);

        return new DerivedPointFilter(filter.build(), base, rowBucket);
    }

    private static Instant later(Instant a, Instant b) {
        return b == null || a.isAfter(b) ? a : b;
    }

    private static Instant earlier(Instant a, Instant b) {
        return b == null || a.isBefore(b) ? a : b;
    }
}
