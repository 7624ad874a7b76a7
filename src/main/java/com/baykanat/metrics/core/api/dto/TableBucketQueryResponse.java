package com.baykanat.metrics.core.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableBucketQueryResponse {

    private String tableId;
    private String columnKey;
    private String entityKind;
    private List<BucketPage> buckets;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BucketPage {
        private String bucketLabel;
        private int sortOrder;
        private String segmentKey;
        private int page;
        private int pageSize;
        private long total;
        private List<String> items;
    }
}
