package com.baykanat.metrics.core.infrastructure.persistence;

import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.ComparisonOp;
import com.baykanat.metrics.core.domain.model.MembersPage;
import com.baykanat.metrics.core.domain.model.PointFilter;
import com.baykanat.metrics.core.infrastructure.sql.AggregationSql;
import com.baykanat.metrics.core.infrastructure.sql.LatestPointSql;
import com.baykanat.metrics.core.infrastructure.sql.PointFilterSql;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * metric_threshold kuralları için entity başına toplama. Değer yoksa ne yapılacağı (0 veya hariç)
 * AggregationFunction.defaultsToZeroWhenAbsent ile belirlenir.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SegmentMetricJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Tek entity için değer; filtre entityId ile daraltılmış olmalı. Hiç point yoksa boş. */
    public Optional<BigDecimal> aggregateForEntity(PointFilter filter, AggregationFunction agg) {
        List<Object> params = new ArrayList<>();
        String where = PointFilterSql.where(filter, params);
        String sql = agg == AggregationFunction.LAST
                ? "SELECT value FROM (" + LatestPointSql.latestRows("value", where, List.of()) + ") latest"
                : "SELECT " + AggregationSql.expression(agg) + " AS value FROM metric_points" + where
                        + " HAVING COUNT(*) > 0";
        List<BigDecimal> rows = jdbcTemplate.queryForList(sql, BigDecimal.class, params.toArray());
        return rows.stream().filter(v -> v != null).findFirst();
    }

    /** Filtredeki entity id kümesi için tek sorguda entity → değer; point'i olmayan entity map'te yok. */
    public Map<String, BigDecimal> aggregateByEntity(PointFilter filter, AggregationFunction agg) {
        List<Object> params = new ArrayList<>();
        String sql = perEntitySql(filter, agg, params);
        Map<String, BigDecimal> values = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            values.put(rs.getString("entity_id"), rs.getBigDecimal("value"));
        }, params.toArray());
        return values;
    }

    /**
     * Kurala uyan entity'ler, id artan sırada sayfalı. Sıfır varsayılanlı agg'lerde evren, bu entityKind için
     * metric_points'te görülen tüm entity'lerdir (penceresinde point'i olmayanlar 0 sayılır).
     */
    public MembersPage matchingPage(PointFilter filter, AggregationFunction agg, ComparisonOp op,
                                    BigDecimal threshold, int limit, long offset) {
        List<Object> params = new ArrayList<>();
        String matched;
        if (agg.defaultsToZeroWhenAbsent()) {
            params.add(filter.getEntityKind());
            String perEntity = perEntitySql(filter, agg, params);
            matched = "SELECT u.entity_id FROM (SELECT DISTINCT entity_id FROM metric_points WHERE entity_kind = ?) u"
                    + " LEFT JOIN (" + perEntity + ") a ON a.entity_id = u.entity_id"
                    + " WHERE COALESCE(a.value, 0) " + op.sqlOperator() + " ?";
        } else {
            String perEntity = perEntitySql(filter, agg, params);
            matched = "SELECT a.entity_id FROM (" + perEntity + ") a WHERE a.value " + op.sqlOperator() + " ?";
        }
        params.add(threshold);

        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM (" + matched + ") m", Long.class,
                params.toArray());

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(limit);
        pageParams.add(offset);
        List<String> items = jdbcTemplate.queryForList(
                "SELECT m.entity_id FROM (" + matched + ") m ORDER BY m.entity_id ASC LIMIT ? OFFSET ?",
                String.class, pageParams.toArray());
        log.debug("Threshold members: agg={}, op={}, total={}", agg.code(), op.symbol(), total);
        return new MembersPage(items, total != null ? total : 0L);
    }

    /** Kolonlar: entity_id, value. */
    private String perEntitySql(PointFilter filter, AggregationFunction agg, List<Object> params) {
        String where = PointFilterSql.where(filter, params);
        if (agg == AggregationFunction.LAST) {
            return LatestPointSql.latestRows("entity_id, value", where, List.of("entity_id"));
        }
        return "SELECT entity_id, " + AggregationSql.expression(agg) + " AS value FROM metric_points" + where
                + " GROUP BY entity_id";
    }
}
