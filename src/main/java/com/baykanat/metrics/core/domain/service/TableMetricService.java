package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.TableMetricListResponse;
import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.exception.NotFoundException;
import com.baykanat.metrics.core.domain.model.PointFilter;
import com.baykanat.metrics.core.domain.model.Segment;
import com.baykanat.metrics.core.domain.model.TableMetricColumn;
import com.baykanat.metrics.core.domain.model.TimeRange;
import com.baykanat.metrics.core.domain.model.rule.TableBinding;
import com.baykanat.metrics.core.domain.model.rule.TableMetricRule;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentJdbcRepository;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentMetricJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tablo kolonlarına bağlı hesaplanmış metrik değerleri (table_metric segmentleri).
 * sum/count için point'i olmayan entity 0 alır, diğer agg'lerde sonuçta yer almaz.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableMetricService {

    private static final String DEFAULT_ENTITY_ID_FIELD = "id";

    private final SegmentJdbcRepository segmentRepository;
    private final SegmentMetricJdbcRepository segmentMetricRepository;
    private final WindowResolver windowResolver;
    private final AppProperties appProperties;

    public TableMetricListResponse list(String tableId, String entityKind) {
        String table = MetricQueryParser.trimToNull(tableId);
        if (table == null) {
            throw new MetricsValidationException("Missing tableId");
        }
        String kind = MetricQueryParser.trimToNull(entityKind);
        return TableMetricListResponse.builder()
                .tableId(table)
                .entityKind(kind)
                .columns(loadColumns(table, null, kind))
                .build();
    }

    /** entityId → değer, aday sırasıyla. Tanımsız kolon 404. */
    public Map<String, BigDecimal> evaluate(String tableId, String columnKey, String entityKind,
                                            List<String> entityIds) {
        int max = appProperties.getSegments().getMaxBucketEntityIds();
        if (entityIds.size() > max) {
            throw new MetricsValidationException("Too many entityIds (max " + max + ")");
        }
        Set<String> candidates = new LinkedHashSet<>();
        entityIds.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .forEach(candidates::add);

        Map<String, BigDecimal> values = new LinkedHashMap<>();
        if (candidates.isEmpty()) {
            return values;
        }

        TableMetricColumn column = loadColumns(tableId, columnKey, entityKind).stream()
                .findFirst()
                .orElseThrow(() -> new NotFoundException(
                        "Metric column not found: " + tableId + "." + columnKey + " (" + entityKind + ")"));

        TimeRange range = windowResolver.resolve(column.getWindow());
        PointFilter filter = PointFilter.builder()
                .metricKey(column.getMetricKey())
                .entityKind(entityKind)
                .entityIds(new ArrayList<>(candidates))
                .start(range.getStart())
                .end(range.getEnd())
                .build();
        Map<String, BigDecimal> aggregated = segmentMetricRepository.aggregateByEntity(filter, column.getAgg());

        for (String id : candidates) {
            BigDecimal value = aggregated.get(id);
            if (value == null && column.showsZeroWhenAbsent()) {
                value = BigDecimal.ZERO;
            }
            if (value != null) {
                values.put(id, value);
            }
        }
        log.debug("Table metric evaluated: tableId={}, columnKey={}, agg={}, candidates={}, values={}",
                tableId, columnKey, column.getAgg().code(), candidates.size(), values.size());
        return values;
    }

    private List<TableMetricColumn> loadColumns(String tableId, String columnKey, String entityKind) {
        List<TableMetricColumn> columns = new ArrayList<>();
        for (Segment segment : segmentRepository.findTableMetrics(tableId, columnKey, entityKind)) {
            if (!(segment.getRule() instanceof TableMetricRule rule)) {
                continue;
            }
            TableBinding table = rule.getTable();
            String column = table != null ? MetricQueryParser.trimToNull(table.getColumnKey()) : null;
            String metricKey = MetricQueryParser.trimToNull(rule.getMetricKey());
            if (column == null || metricKey == null) {
                log.warn("Skipping malformed table_metric segment: key={}", segment.getKey());
                continue;
            }
            String label = MetricQueryParser.trimToNull(table.getColumnLabel());
            String entityIdField = MetricQueryParser.trimToNull(table.getEntityIdField());
            columns.add(TableMetricColumn.builder()
                    .segmentKey(segment.getKey())
                    .columnKey(column)
                    .columnLabel(label != null ? label : column)
                    .entityKind(segment.getEntityKind())
                    .entityIdField(entityIdField != null ? entityIdField : DEFAULT_ENTITY_ID_FIELD)
                    .metricKey(metricKey)
                    .agg(rule.effectiveAgg())
                    .window(rule.effectiveWindow())
                    .format(MetricQueryParser.trimToNull(table.getFormat()))
                    .decimals(table.getDecimals())
                    .sortOrder(table.getSortOrder() != null ? table.getSortOrder() : 0)
                    .build());
        }
        columns.sort(TableMetricColumn.DISPLAY_ORDER);
        return columns;
    }
}
