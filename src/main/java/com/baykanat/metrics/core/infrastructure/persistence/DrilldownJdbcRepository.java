package com.baykanat.metrics.core.infrastructure.persistence;

import com.baykanat.metrics.core.api.dto.DrilldownResponse.ContributorRow;
import com.baykanat.metrics.core.domain.model.Granularity;
import com.baykanat.metrics.core.domain.model.MetricPoint;
import com.baykanat.metrics.core.domain.model.PointFilter;
import com.baykanat.metrics.core.infrastructure.sql.DimensionKeys;
import com.baykanat.metrics.core.infrastructure.sql.PointFilterSql;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/** Ham point sayfalama ve contributor (entity, data source, dimension) kırılımları. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DrilldownJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String POINT_COLUMNS = """
            id, entity_kind, entity_id, metric_key, data_source_id, sync_run_id, ingest_batch_id,
            date, granularity, value, dimensions::text AS dimensions, dimensions_hash, created_at, updated_at
            """;

    private static final RowMapper<MetricPoint> POINT_ROW_MAPPER = (rs, rowNum) -> MetricPoint.builder()
            .id(rs.getString("id"))
            .entityKind(rs.getString("entity_kind"))
            .entityId(rs.getString("entity_id"))
            .metricKey(rs.getString("metric_key"))
            .dataSourceId(rs.getString("data_source_id"))
            .syncRunId(rs.getString("sync_run_id"))
            .ingestBatchId(rs.getString("ingest_batch_id"))
            .date(rs.getObject("date", OffsetDateTime.class).toInstant())
            .granularity(Granularity.parse(rs.getString("granularity")).orElse(null))
            .value(rs.getBigDecimal("value"))
            .dimensions(rs.getString("dimensions"))
            .dimensionsHash(rs.getString("dimensions_hash"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class).toInstant())
            .build();

    public long count(PointFilter filter) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM metric_points" + PointFilterSql.where(filter, params);
        Long total = jdbcTemplate.queryForObject(sql, Long.class, params.toArray());
        return total != null ? total : 0L;
    }

    /** En yeni önce; aynı tarihte id ile kararlı sıra. */
    public List<MetricPoint> findPage(PointFilter filter, int limit, long offset) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT " + POINT_COLUMNS + " FROM metric_points"
                + PointFilterSql.where(filter, params)
                + " ORDER BY date DESC, id DESC LIMIT ? OFFSET ?";
        params.add(limit);
        params.add(offset);
        return jdbcTemplate.query(sql, POINT_ROW_MAPPER, params.toArray());
    }

    public List<ContributorRow> topByEntity(PointFilter filter, int limit) {
        return topContributors("entity_id", filter, limit);
    }

    public List<ContributorRow> topByDataSource(PointFilter filter, int limit) {
        return topContributors("data_source_id", filter, limit);
    }

    public List<ContributorRow> topByDimension(String dimensionKey, PointFilter filter, int limit) {
        return topContributors(DimensionKeys.extract(dimensionKey), filter, limit);
    }

    /** groupExpr sadece bu sınıftaki sabit kolonlar veya DimensionKeys çıktısı olabilir. */
    private List<ContributorRow> topContributors(String groupExpr, PointFilter filter, int limit) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT " + groupExpr + " AS contributor_key, SUM(value) AS value_sum, COUNT(*) AS point_count"
                + " FROM metric_points" + PointFilterSql.where(filter, params)
                + " GROUP BY " + groupExpr
                + " ORDER BY value_sum DESC, contributor_key ASC LIMIT ?";
        params.add(limit);
        return jdbcTemplate.query(sql, (rs, rowNum) -> new ContributorRow(
                rs.getString("contributor_key"),
                rs.getBigDecimal("value_sum"),
                rs.getLong("point_count")), params.toArray());
    }
}
