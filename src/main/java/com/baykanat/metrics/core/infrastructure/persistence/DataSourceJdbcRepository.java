package com.baykanat.metrics.core.infrastructure.persistence;

import com.baykanat.metrics.core.domain.model.DataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class DataSourceJdbcRepository {

    private static final RowMapper<DataSource> ROW_MAPPER = (rs, rowNum) -> DataSource.builder()
            .id(rs.getString("id"))
            .entityKind(rs.getString("entity_kind"))
            .entityId(rs.getString("entity_id"))
            .connectorKey(rs.getString("connector_key"))
            .sourceKind(rs.getString("source_kind"))
            .externalRef(rs.getString("external_ref"))
            .enabled(rs.getBoolean("enabled"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class).toInstant())
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class).toInstant())
            .build();

    private final JdbcTemplate jdbcTemplate;

    /** Id unique; çakışmada DuplicateKeyException. */
    public void insert(DataSource dataSource) {
        jdbcTemplate.update("""
                        INSERT INTO data_sources (id, entity_kind, entity_id, connector_key, source_kind, external_ref,
                                                  enabled, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, now(), now())
                        """,
                dataSource.getId(), dataSource.getEntityKind(), dataSource.getEntityId(),
                dataSource.getConnectorKey(), dataSource.getSourceKind(), dataSource.getExternalRef(),
                dataSource.isEnabled());
    }

    public Optional<DataSource> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM data_sources WHERE id = ?", ROW_MAPPER, id).stream().findFirst();
    }

    public List<DataSource> list(String entityKind, String entityId) {
        StringBuilder sql = new StringBuilder("SELECT * FROM data_sources WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (entityKind != null) {
            sql.append(" AND entity_kind = ?");
            params.add(entityKind);
        }
        if (entityId != null) {
            sql.append(" AND entity_id = ?");
            params.add(entityId);
        }
        sql.append(" ORDER BY id ASC");
        return jdbcTemplate.query(sql.toString(), ROW_MAPPER, params.toArray());
    }
}
