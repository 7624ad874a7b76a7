package com.baykanat.metrics.core.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** columnKey verilmişse tek kolonun kovaları, verilmemişse tablodaki tüm kolonlar. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableBucketListResponse {

    private String tableId;
    private String columnKey;
    private String columnLabel;
    private String entityKind;
    private String entityIdField;
    private List<BucketDefinition> buckets;
    private List<Column> columns;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Column {
        private String columnKey;
        private String columnLabel;
        private String entityKind;
        private String entityIdField;
        private List<BucketDefinition> buckets;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BucketDefinition {
        private String segmentKey;
        private String bucketLabel;
        private int sortOrder;
    }
}
