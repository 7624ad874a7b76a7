package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.TableBucketListResponse;
import com.baykanat.metrics.core.api.dto.TableBucketQueryRequest;
import com.baykanat.metrics.core.api.dto.TableBucketQueryResponse;
import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.model.BucketAssignment;
import com.baykanat.metrics.core.domain.model.MembersPage;
import com.baykanat.metrics.core.domain.model.Segment;
import com.baykanat.metrics.core.domain.model.TableBucket;
import com.baykanat.metrics.core.domain.model.rule.RuleKind;
import com.baykanat.metrics.core.domain.model.rule.TableBinding;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Tablo kolonuna bağlı segment kovaları. Atama sıralı ve ilk eşleşen kazanır: kovalar öncelik sırasıyla
 * değerlendirilir, atanmış entity sonraki kovalara girmez.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableBucketService {

    private static final String DEFAULT_ENTITY_ID_FIELD = "id";
    private static final int DEFAULT_QUERY_PAGE_SIZE = 25;

    private final SegmentJdbcRepository segmentRepository;
    private final SegmentRuleEvaluator segmentRuleEvaluator;
    private final AppProperties appProperties;

    /** Öncelik sırasına dizilmiş kovalar; etiketsiz segmentler ve table_metric kolonları atlanır. */
    public List<TableBucket> loadBuckets(String tableId, String columnKey, String entityKind) {
        List<TableBucket> buckets = new ArrayList<>();
        for (Segment segment : segmentRepository.findTableBound(tableId, columnKey, entityKind)) {
            if (segment.getRule().ruleKind() == RuleKind.TABLE_METRIC) {
                continue;
            }
            TableBinding table = segment.getRule().getTable();
            String bucketLabel = MetricQueryParser.trimToNull(table.getBucketLabel());
            String boundColumn = MetricQueryParser.trimToNull(table.getColumnKey());
            if (bucketLabel == null || boundColumn == null) {
                continue;
            }
            String entityIdField = MetricQueryParser.trimToNull(table.getEntityIdField());
            buckets.add(TableBucket.builder()
                    .segmentKey(segment.getKey())
                    .bucketLabel(bucketLabel)
                    .sortOrder(table.getSortOrder() != null ? table.getSortOrder() : 0)
                    .columnKey(boundColumn)
                    .columnLabel(MetricQueryParser.trimToNull(table.getColumnLabel()))
                    .entityKind(segment.getEntityKind())
                    .entityIdField(entityIdField != null ? entityIdField : DEFAULT_ENTITY_ID_FIELD)
                    .segment(segment)
                    .build());
        }
        buckets.sort(TableBucket.PRIORITY);
        return buckets;
    }

    public TableBucketListResponse list(String tableId, String columnKey, String entityKind) {
        String table = MetricQueryParser.trimToNull(tableId);
        if (table == null) {
            throw new MetricsValidationException("Missing tableId");
        }
        String column = MetricQueryParser.trimToNull(columnKey);
        String kind = MetricQueryParser.trimToNull(entityKind);
        List<TableBucket> buckets = loadBuckets(table, column, kind);

        if (column != null) {
            return TableBucketListResponse.builder()
                    .tableId(table)
                    .columnKey(column)
                    .columnLabel(buckets.stream().map(TableBucket::getColumnLabel)
                            .filter(Objects::nonNull).findFirst().orElse(null))
                    .entityKind(buckets.stream().map(TableBucket::getEntityKind).findFirst().orElse(kind))
                    .entityIdField(buckets.stream().map(TableBucket::getEntityIdField).findFirst()
                            .orElse(DEFAULT_ENTITY_ID_FIELD))
                    .buckets(buckets.stream().map(TableBucketService::toDefinition).toList())
                    .build();
        }

        Map<String, List<TableBucket>> byColumn = new TreeMap<>();
        for (TableBucket bucket : buckets) {
            byColumn.computeIfAbsent(bucket.getColumnKey(), k -> new ArrayList<>()).add(bucket);
        }
        List<TableBucketListResponse.Column> columns = new ArrayList<>();
        byColumn.forEach((key, columnBuckets) -> columns.add(TableBucketListResponse.Column.builder()
                .columnKey(key)
                .columnLabel(columnBuckets.stream().map(TableBucket::getColumnLabel)
                        .filter(Objects::nonNull).findFirst().orElse(null))
                .entityKind(columnBuckets.get(0).getEntityKind())
                .entityIdField(columnBuckets.get(0).getEntityIdField())
                .buckets(columnBuckets.stream().map(TableBucketService::toDefinition).toList())
                .build()));
        return TableBucketListResponse.builder()
                .tableId(table)
                .entityKind(kind)
                .columns(columns)
                .build();
    }

    /** Her kovanın ham üyelik sayfası (kovalar arası ayrıştırma yapılmaz). */
    public TableBucketQueryResponse query(TableBucketQueryRequest request) {
        int pageSize = request.getPageSize() != null ? request.getPageSize() : DEFAULT_QUERY_PAGE_SIZE;
        Map<String, Integer> bucketPages = request.getBucketPages() != null ? request.getBucketPages() : Map.of();
        List<TableBucketQueryResponse.BucketPage> pages = new ArrayList<>();

        for (TableBucket bucket : loadBuckets(request.getTableId(), request.getColumnKey(), request.getEntityKind())) {
            Integer requested = bucketPages.get(bucket.getSegmentKey());
            int page = requested != null && requested > 0 ? requested : 1;
            MembersPage members;
            try {
                members = segmentRuleEvaluator.members(bucket.getSegmentKey(), request.getEntityKind(), page, pageSize);
            } catch (MetricsValidationException e) {
                throw new MetricsValidationException(
                        "Bucket segment query failed (" + bucket.getSegmentKey() + "): " + e.getMessage(), e);
            }
            pages.add(TableBucketQueryResponse.BucketPage.builder()
                    .bucketLabel(bucket.getBucketLabel())
                    .sortOrder(bucket.getSortOrder())
                    .segmentKey(bucket.getSegmentKey())
                    .page(page)
                    .pageSize(pageSize)
                    .total(members.getTotal())
                    .items(members.getItems())
                    .build());
        }
        return TableBucketQueryResponse.builder()
                .tableId(request.getTableId())
                .columnKey(request.getColumnKey())
                .entityKind(request.getEntityKind())
                .buckets(pages)
                .build();
    }

    /**
     * entityId → ilk eşleşen kova (yoksa null). Kovalar sırayla, sadece henüz atanmamış id'ler üzerinde
     * değerlendirilir; sıra değiştirilirse sonuç değişir.
     */
    public Map<String, BucketAssignment> assign(String tableId, String columnKey, String entityKind,
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

        Map<String, BucketAssignment> values = new LinkedHashMap<>();
        candidates.forEach(id -> values.put(id, null));
        if (candidates.isEmpty()) {
            return values;
        }

        Set<String> unassigned = new LinkedHashSet<>(candidates);
        for (TableBucket bucket : loadBuckets(tableId, columnKey, entityKind)) {
            if (unassigned.isEmpty()) {
                break;
            }
            Set<String> matched = segmentRuleEvaluator.matchingIds(bucket.getSegment(), entityKind, unassigned);
            for (String id : matched) {
                values.put(id, new BucketAssignment(bucket.getBucketLabel(), bucket.getSegmentKey()));
            }
            unassigned.removeAll(matched);
        }
        log.debug("Table buckets assigned: tableId={}, columnKey={}, candidates={}, unassigned={}",
                tableId, columnKey, candidates.size(), unassigned.size());
        return values;
    }

    private static TableBucketListResponse.BucketDefinition toDefinition(TableBucket bucket) {
        return TableBucketListResponse.BucketDefinition.builder()
                .segmentKey(bucket.getSegmentKey())
                .bucketLabel(bucket.getBucketLabel())
                .sortOrder(bucket.getSortOrder())
                .build();
    }
}
