package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.BatchQueryResponse;
import com.baykanat.metrics.core.api.dto.BatchQueryResult;
import com.baykanat.metrics.core.api.dto.MetricQueryRequest;
import com.baykanat.metrics.core.api.dto.QueryMeta;
import com.baykanat.metrics.core.api.dto.QueryResponse;
import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.model.AggregateRow;
import com.baykanat.metrics.core.domain.model.MetricQuery;
import com.baykanat.metrics.core.infrastructure.persistence.MetricQueryJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Tekli ve batch toplama sorguları. Batch'te sorgular paralel çalışır, sonuçlar giriş sırasıyla döner. */
@Slf4j
@Service
public class MetricQueryService {

    private final MetricQueryParser queryParser;
    private final MetricQueryJdbcRepository queryRepository;
    private final AppProperties appProperties;
    private final TaskExecutor queryExecutor;

    public MetricQueryService(MetricQueryParser queryParser,
                              MetricQueryJdbcRepository queryRepository,
                              AppProperties appProperties,
                              @Qualifier("queryExecutor") TaskExecutor queryExecutor) {
        this.queryParser = queryParser;
        this.queryRepository = queryRepository;
        this.appProperties = appProperties;
        this.queryExecutor = queryExecutor;
    }

    public QueryResponse query(MetricQueryRequest request) {
        MetricQuery query = queryParser.parse(request);
        List<AggregateRow> rows = queryRepository.aggregate(query);
        log.debug("Query metricKey={} returned {} rows", query.getFilter().getMetricKey(), rows.size());
        return QueryResponse.builder()
                .data(rows.stream().map(MetricQueryService::toOutputRow).toList())
                .meta(toMeta(query))
                .build();
    }

    /** Liste boş veya limitin üstündeyse tüm istek reddedilir; aksi halde her slot kendi hatasını taşır. */
    public BatchQueryResponse queryBatch(List<MetricQueryRequest> requests) {
        int maxQueries = appProperties.getQuery().getMaxBatchQueries();
        if (requests == null || requests.isEmpty()) {
            throw new MetricsValidationException("queries must not be empty");
        }
        if (requests.size() > maxQueries) {
            throw new MetricsValidationException("Too many queries (max " + maxQueries + ")");
        }

        List<CompletableFuture<BatchQueryResult>> futures = requests.stream()
                .map(this::submit)
                .toList();
        List<BatchQueryResult> results = futures.stream().map(CompletableFuture::join).toList();

        long failed = results.stream().filter(r -> r.getError() != null).count();
        log.info("Batch query finished: {} queries, {} failed", results.size(), failed);
        return new BatchQueryResponse(results);
    }

    /** Executor kabul etmezse slot hata olarak tamamlanır; diğer slotlar etkilenmez. */
    private CompletableFuture<BatchQueryResult> submit(MetricQueryRequest request) {
        try {
            return CompletableFuture.supplyAsync(() -> runIsolated(request), queryExecutor);
        } catch (TaskRejectedException e) {
            log.warn("Batch query slot rejected by executor: {}", e.getMessage());
            return CompletableFuture.completedFuture(BatchQueryResult.failure("Query capacity exceeded, retry later"));
        }
    }

    private BatchQueryResult runIsolated(MetricQueryRequest request) {
        try {
            return BatchQueryResult.success(query(request));
        } catch (MetricsValidationException e) {
            return BatchQueryResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Batch query slot failed: {}", e.getMessage(), e);
            return BatchQueryResult.failure("Query failed");
        }
    }

    static Map<String, Object> toOutputRow(AggregateRow row) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (row.getBucket() != null) {
            out.put("bucket", row.getBucket());
        }
        if (row.getEntityId() != null) {
            out.put("entityId", row.getEntityId());
        }
        out.putAll(row.getDimensions());
        out.put("value", row.getValue());
        return out;
    }

    static QueryMeta toMeta(MetricQuery query) {
        return QueryMeta.builder()
                .metricKey(query.getFilter().getMetricKey())
                .start(query.getFilter().getStart())
                .end(query.getFilter().getEnd())
                .bucket(query.getBucket().code())
                .agg(query.getAgg().code())
                .groupBy(query.getGroupBy())
                .groupByEntityId(query.isGroupByEntityId())
                .build();
    }
}
