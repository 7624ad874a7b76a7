package com.baykanat.metrics.core.infrastructure.persistence;

import com.baykanat.metrics.core.domain.model.AggregateRow;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.MetricQuery;
import com.baykanat.metrics.core.infrastructure.sql.AggregationSql;
import com.baykanat.metrics.core.infrastructure.sql.DimensionKeys;
import com.baykanat.metrics.core.infrastructure.sql.LatestPointSql;
import com.baykanat.metrics.core.infrastructure.sql.PointFilterSql;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MetricQuery'yi tek SQL'e derler. Çıktı kolonları: bucket?, entity_id?, dim_0..n, value.
 * agg=last için LatestPointSql ile partition başına en yeni point seçilir.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MetricQueryJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    public List<AggregateRow> aggregate(MetricQuery query) {
        List<Object> params = new ArrayList<>();
        String where = PointFilterSql.where(query.getFilter(), params);

        // Gruplama ifadeleri ve çıktı alias'ları aynı sırada
        List<String> groupExprs = new ArrayList<>();
        List<String> aliases = new ArrayList<>();
        if (!query.getBucket().isNone()) {
            groupExprs.add("date_trunc('" + query.getBucket().code() + "', date, 'UTC')");
            aliases.add("bucket");
        }
        if (query.isGroupByEntityId()) {
            groupExprs.add("entity_id");
            aliases.add("entity_id");
        }
        List<String> groupBy = query.getGroupBy();
        for (int i = 0; i < groupBy.size(); i++) {
            groupExprs.add(DimensionKeys.extract(groupBy.get(i)));
            aliases.add("dim_" + i);
        }

        String sql = query.getAgg() == AggregationFunction.LAST
                ? latestSql(where, groupExprs, aliases)
                : groupedSql(query.getAgg(), where, groupExprs, aliases);

        log.debug("Aggregate query: agg={}, bucket={}, groupBy={}, sql={}",
                query.getAgg().code(), query.getBucket().code(), groupBy, sql);
        return jdbcTemplate.query(sql, rowMapper(query), params.toArray());
    }

    private String groupedSql(AggregationFunction agg, String where, List<String> groupExprs, List<String> aliases) {
        StringBuilder sql = new StringBuilder("SELECT ");
        for (int i = 0; i < groupExprs.size(); i++) {
            sql.append(groupExprs.get(i)).append(" AS ").append(aliases.get(i)).append(", ");
        }
        sql.append(AggregationSql.expression(agg)).append(" AS value FROM metric_points").append(where);
        if (!groupExprs.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupExprs));
            sql.append(" ORDER BY ").append(String.join(", ", aliases));
        }
        return sql.toString();
    }

    private String latestSql(String where, List<String> groupExprs, List<String> aliases) {
        StringBuilder projection = new StringBuilder();
        for (int i = 0; i < groupExprs.size(); i++) {
            projection.append(groupExprs.get(i)).append(" AS ").append(aliases.get(i)).append(", ");
        }
        projection.append("value");

        StringBuilder sql = new StringBuilder("SELECT ");
        for (String alias : aliases) {
            sql.append("latest.").append(alias).append(", ");
        }
        sql.append("latest.value FROM (")
                .append(LatestPointSql.latestRows(projection.toString(), where, groupExprs))
                .append(") latest");
        if (!aliases.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", aliases.stream().map(a -> "latest." + a).toList()));
        }
        return sql.toString();
    }

    private RowMapper<AggregateRow> rowMapper(MetricQuery query) {
        return (rs, rowNum) -> {
            OffsetDateTime bucket = query.getBucket().isNone() ? null : rs.getObject("bucket", OffsetDateTime.class);
            String entityId = query.isGroupByEntityId() ? rs.getString("entity_id") : null;
            Map<String, String> dimensions = new LinkedHashMap<>();
            for (int i = 0; i < query.getGroupBy().size(); i++) {
                dimensions.put(query.getGroupBy().get(i), rs.getString("dim_" + i));
            }
            return new AggregateRow(
                    bucket != null ? bucket.toInstant() : null,
                    entityId,
                    dimensions,
                    rs.getBigDecimal("value"));
        };
    }
}
