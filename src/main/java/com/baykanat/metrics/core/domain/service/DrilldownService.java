package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.api.dto.DrilldownRequest;
import com.baykanat.metrics.core.api.dto.DrilldownResponse;
import com.baykanat.metrics.core.api.dto.MetricPointResponse;
import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.mapper.MetricPointMapper;
import com.baykanat.metrics.core.domain.model.DerivedPointFilter;
import com.baykanat.metrics.core.domain.model.MetricQuery;
import com.baykanat.metrics.core.domain.model.PointFilter;
import com.baykanat.metrics.core.infrastructure.persistence.DrilldownJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Drilldown: filtreyi çöz (doğrudan veya satırdan türet), sayfalı point'leri ve contributor'ları döndür. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrilldownService {

    private static final int DEFAULT_PAGE_SIZE = 50;

    private final MetricQueryParser queryParser;
    private final DrilldownFilterResolver filterResolver;
    private final DrilldownJdbcRepository drilldownRepository;
    private final MetricPointMapper pointMapper;
    private final AppProperties appProperties;

    public DrilldownResponse drilldown(DrilldownRequest request) {
        int page = request.getPage() != null ? request.getPage() : 1;
        int pageSize = request.getPageSize() != null ? request.getPageSize() : DEFAULT_PAGE_SIZE;
        int maxPageSize = appProperties.getQuery().getMaxDrilldownPageSize();
        if (page < 1) {
            throw new MetricsValidationException("page must be >= 1");
        }
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw new MetricsValidationException("pageSize must be between 1 and " + maxPageSize);
        }

        PointFilter filter;
        DrilldownResponse.DerivedFrom derivedFrom = null;
        List<String> groupBy = List.of();
        if (request.getPointFilter() != null) {
            filter = queryParser.parseFilter(request.getPointFilter());
        } else if (request.getBaseQuery() != null && request.getRowContext() != null) {
            DerivedPointFilter derived = filterResolver.derive(request.getBaseQuery(), request.getRowContext());
            filter = derived.getFilter();
            MetricQuery base = derived.getBaseQuery();
            groupBy = base.getGroupBy();
            derivedFrom = DrilldownResponse.DerivedFrom.builder()
                    .bucket(base.getBucket().code())
                    .agg(base.getAgg().code())
                    .rowBucket(derived.getRowBucket())
                    .groupBy(groupBy)
                    .groupByEntityId(base.isGroupByEntityId())
                    .build();
        } else {
            throw new MetricsValidationException("Provide either pointFilter, or baseQuery + rowContext");
        }

        long total = drilldownRepository.count(filter);
        long offset = (long) (page - 1) * pageSize;
        List<MetricPointResponse> points = drilldownRepository.findPage(filter, pageSize, offset).stream()
                .map(pointMapper::toResponse)
                .toList();

        DrilldownResponse.Contributors contributors = null;
        if (!Boolean.FALSE.equals(request.getIncludeContributors())) {
            contributors = contributors(filter, groupBy);
        }
        log.debug("Drilldown metricKey={} total={} page={} derived={}",
                filter.getMetricKey(), total, page, derivedFrom != null);

        return DrilldownResponse.builder()
                .meta(new DrilldownResponse.Meta(derivedFrom, filter))
                .pagination(new DrilldownResponse.Pagination(page, pageSize, total))
                .points(points)
                .contributors(contributors)
                .build();
    }

    private DrilldownResponse.Contributors contributors(PointFilter filter, List<String> groupBy) {
        int limit = appProperties.getQuery().getContributorLimit();
        DrilldownResponse.DimensionContributors byDimension = null;
        if (groupBy.size() == 1) {
            String key = groupBy.get(0);
            byDimension = new DrilldownResponse.DimensionContributors(key,
                    drilldownRepository.topByDimension(key, filter, limit));
        }
        return DrilldownResponse.Contributors.builder()
                .byEntity(drilldownRepository.topByEntity(filter, limit))
                .byDataSource(drilldownRepository.topByDataSource(filter, limit))
                .byDimension(byDimension)
                .build();
    }
}
