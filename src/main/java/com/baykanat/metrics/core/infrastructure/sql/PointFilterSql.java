package com.baykanat.metrics.core.infrastructure.sql;

import com.baykanat.metrics.core.domain.model.PointFilter;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** PointFilter → WHERE cümlesi + pozisyonel parametreler. Zaman aralığı yarı açık: date >= start AND date < end. */
public final class PointFilterSql {

    private PointFilterSql() {
    }

    /** " WHERE ..." veya koşul yoksa boş string; parametreler params'a eklenir. */
    public static String where(PointFilter filter, List<Object> params) {
        List<String> conditions = new ArrayList<>();

        if (filter.getMetricKey() != null) {
            conditions.add("metric_key = ?");
            params.add(filter.getMetricKey());
        }
        if (filter.getStart() != null) {
            conditions.add("date >= ?");
            params.add(timestamp(filter.getStart()));
        }
        if (filter.getEnd() != null) {
            conditions.add("date < ?");
            params.add(timestamp(filter.getEnd()));
        }
        if (filter.getEntityKind() != null) {
            conditions.add("entity_kind = ?");
            params.add(filter.getEntityKind());
        }
        if (filter.getEntityId() != null) {
            conditions.add("entity_id = ?");
            params.add(filter.getEntityId());
        }
        if (filter.getEntityIds() != null && !filter.getEntityIds().isEmpty()) {
            conditions.add("entity_id IN (" + placeholders(filter.getEntityIds()) + ")");
            params.addAll(filter.getEntityIds());
        }
        if (filter.getDataSourceId() != null) {
            conditions.add("data_source_id = ?");
            params.add(filter.getDataSourceId());
        }
        if (filter.getSourceGranularity() != null) {
            conditions.add("granularity = ?");
            params.add(filter.getSourceGranularity().code());
        }
        if (filter.getDimensions() != null) {
            for (Map.Entry<String, Object> entry : filter.getDimensions().entrySet()) {
                String expr = DimensionKeys.extract(entry.getKey());
                if (entry.getValue() == null) {
                    conditions.add(expr + " IS NULL");
                } else {
                    conditions.add(expr + " = ?");
                    params.add(String.valueOf(entry.getValue()));
                }
            }
        }

        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    /** Instant'ı timestamptz bağlaması için UTC OffsetDateTime'a çevirir. */
    public static OffsetDateTime timestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public static String placeholders(Collection<?> values) {
        return String.join(",", values.stream().map(v -> "?").toList());
    }
}
