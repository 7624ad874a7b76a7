package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Comparator;

/** Bir tablo kolonuna bağlı segment; kova etiketi ve öncelik sırası ile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableBucket {

    /** sortOrder artan, sonra etiket, sonra segment key. */
    public static final Comparator<TableBucket> PRIORITY = Comparator
            .comparingInt(TableBucket::getSortOrder)
            .thenComparing(TableBucket::getBucketLabel)
            .thenComparing(TableBucket::getSegmentKey);

    private String segmentKey;
    private String bucketLabel;
    private int sortOrder;
    private String columnKey;
    private String columnLabel;
    private String entityKind;
    private String entityIdField;
    private Segment segment;
}
