package com.baykanat.metrics.core.infrastructure.persistence;

import com.baykanat.metrics.core.domain.model.Segment;
import com.baykanat.metrics.core.domain.model.rule.SegmentRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** metrics_segments CRUD; rule JSONB ↔ tipli SegmentRule Jackson ile. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SegmentJdbcRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String SELECT_COLUMNS = """
            SELECT id, key, entity_kind, label, description, rule::text AS rule, is_active, created_at, updated_at
            FROM metrics_segments
            """;

    public Optional<Segment> findByKey(String key) {
        List<Segment> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE key = ?", segmentRowMapper(), key);
        return rows.stream().findFirst();
    }

    /** q: key/label/description üzerinde büyük-küçük harf duyarsız alt string. */
    public List<Segment> list(String entityKind, String q, boolean includeInactive) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (entityKind != null) {
            sql.append(" AND entity_kind = ?");
            params.add(entityKind);
        }
        if (!includeInactive) {
            sql.append(" AND is_active = true");
        }
        if (q != null) {
            String pattern = "%" + q + "%";
            sql.append(" AND (key ILIKE ? OR label ILIKE ? OR description ILIKE ?)");
            params.add(pattern);
            params.add(pattern);
            params.add(pattern);
        }
        sql.append(" ORDER BY key ASC");
        return jdbcTemplate.query(sql.toString(), segmentRowMapper(), params.toArray());
    }

    /** Aktif ve belirtilen tablo kolonuna bağlı segmentler; columnKey null ise tablodaki tüm kolonlar. */
    public List<Segment> findTableBound(String tableId, String columnKey, String entityKind) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
                .append(" WHERE is_active = true AND (rule -> 'table' ->> 'tableId') = ?");
        List<Object> params = new ArrayList<>();
        params.add(tableId);
        if (columnKey != null) {
            sql.append(" AND (rule -> 'table' ->> 'columnKey') = ?");
            params.add(columnKey);
        } else {
            sql.append(" AND (rule -> 'table' ->> 'columnKey') IS NOT NULL");
        }
        if (entityKind != null) {
            sql.append(" AND entity_kind = ?");
            params.add(entityKind);
        }
        sql.append(" ORDER BY key ASC");
        return jdbcTemplate.query(sql.toString(), segmentRowMapper(), params.toArray());
    }

    /** Aktif table_metric kolonları; columnKey null ise tablonun tüm metrik kolonları. */
    public List<Segment> findTableMetrics(String tableId, String columnKey, String entityKind) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
                .append(" WHERE is_active = true AND (rule ->> 'kind') = 'table_metric'")
                .append(" AND (rule -> 'table' ->> 'tableId') = ?");
        List<Object> params = new ArrayList<>();
        params.add(tableId);
        if (columnKey != null) {
            sql.append(" AND (rule -> 'table' ->> 'columnKey') = ?");
            params.add(columnKey);
        }
        if (entityKind != null) {
            sql.append(" AND entity_kind = ?");
            params.add(entityKind);
        }
        sql.append(" ORDER BY key ASC");
        return jdbcTemplate.query(sql.toString(), segmentRowMapper(), params.toArray());
    }

    /** Key unique; çakışmada DuplicateKeyException. */
    public void insert(Segment segment) {
        jdbcTemplate.update("""
                        INSERT INTO metrics_segments (id, key, entity_kind, label, description, rule, is_active, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, now(), now())
                        """,
                segment.getId(), segment.getKey(), segment.getEntityKind(), segment.getLabel(),
                segment.getDescription(), toJson(segment.getRule()), segment.isActive());
    }

    public int update(Segment segment) {
        return jdbcTemplate.update("""
                        UPDATE metrics_segments
                        SET label = ?, description = ?, rule = ?::jsonb, is_active = ?, updated_at = now()
                        WHERE key = ?
                        """,
                segment.getLabel(), segment.getDescription(), toJson(segment.getRule()), segment.isActive(),
                segment.getKey());
    }

    public int deleteByKey(String key) {
        return jdbcTemplate.update("DELETE FROM metrics_segments WHERE key = ?", key);
    }

    private String toJson(SegmentRule rule) {
        try {
            return objectMapper.writeValueAsString(rule);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Segment rule is not serializable", e);
        }
    }

    private RowMapper<Segment> segmentRowMapper() {
        return (rs, rowNum) -> {
            String key = rs.getString("key");
            SegmentRule rule;
            try {
                rule = objectMapper.readValue(rs.getString("rule"), SegmentRule.class);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Segment rule is invalid for segment " + key, e);
            }
            return Segment.builder()
                    .id(rs.getString("id"))
                    .key(key)
                    .entityKind(rs.getString("entity_kind"))
                    .label(rs.getString("label"))
                    .description(rs.getString("description"))
                    .rule(rule)
                    .active(rs.getBoolean("is_active"))
                    .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
                    .updatedAt(rs.getObject("updated_at", OffsetDateTime.class).toInstant())
                    .build();
        };
    }
}
