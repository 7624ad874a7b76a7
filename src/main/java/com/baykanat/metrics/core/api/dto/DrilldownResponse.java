package com.baykanat.metrics.core.api.dto;

import com.baykanat.metrics.core.domain.model.PointFilter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/** Drilldown sonucu: çözülmüş filtre, sayfa, ham point'ler, opsiyonel contributor'lar. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DrilldownResponse {

    private Meta meta;
    private Pagination pagination;
    private List<MetricPointResponse> points;
    private Contributors contributors;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {
        /** pointFilter ile gelindiyse null. */
        private DerivedFrom derivedFrom;
        private PointFilter resolvedPointFilter;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DerivedFrom {
        private String bucket;
        private String agg;
        private String rowBucket;
        private List<String> groupBy;
        private boolean groupByEntityId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int pageSize;
        private long total;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Contributors {
        private List<ContributorRow> byEntity;
        private List<ContributorRow> byDataSource;
        /** Sadece tek groupBy key'li sorgudan türetilmişse dolu. */
        private DimensionContributors byDimension;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DimensionContributors {
        private String key;
        private List<ContributorRow> rows;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContributorRow {
        private String key;
        private BigDecimal valueSum;
        private long pointCount;
    }
}
