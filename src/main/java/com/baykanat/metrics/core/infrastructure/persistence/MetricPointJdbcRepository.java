package com.baykanat.metrics.core.infrastructure.persistence;

import com.baykanat.metrics.core.domain.model.MetricPoint;
import com.baykanat.metrics.core.infrastructure.sql.PointFilterSql;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.List;

/**
 * metric_points upsert'i. Kimlik (data_source_id, metric_key, date, granularity, dimensions_hash);
 * çakışmada sadece value, provenance ve updated_at güncellenir.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MetricPointJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String UPSERT_SQL = """
            INSERT INTO metric_points (id, entity_kind, entity_id, metric_key, data_source_id, sync_run_id, ingest_batch_id,
                                       date, granularity, value, dimensions, dimensions_hash, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, now(), now())
            ON CONFLICT (data_source_id, metric_key, date, granularity, dimensions_hash) DO UPDATE
            SET value = EXCLUDED.value,
                sync_run_id = EXCLUDED.sync_run_id,
                ingest_batch_id = EXCLUDED.ingest_batch_id,
                updated_at = now()
            """;

    /** Tek chunk'ı JDBC batch olarak yazar; chunk içinde aynı kimlik iki kez olmamalı. */
    public int upsertChunk(List<MetricPoint> points) {
        if (points.isEmpty()) {
            return 0;
        }
        jdbcTemplate.batchUpdate(UPSERT_SQL, points, points.size(),
                (ps, point) -> {
                    ps.setString(1, point.getId());
                    ps.setString(2, point.getEntityKind());
                    ps.setString(3, point.getEntityId());
                    ps.setString(4, point.getMetricKey());
                    ps.setString(5, point.getDataSourceId());
                    ps.setString(6, point.getSyncRunId());
                    ps.setString(7, point.getIngestBatchId());
                    ps.setObject(8, PointFilterSql.timestamp(point.getDate()));
                    ps.setString(9, point.getGranularity().code());
                    ps.setBigDecimal(10, point.getValue());
                    if (point.getDimensions() != null) {
                        ps.setString(11, point.getDimensions());
                    } else {
                        ps.setNull(11, Types.OTHER);
                    }
                    ps.setString(12, point.getDimensionsHash());
                });
        return points.size();
    }
}
