package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Entity'nin yerleştiği ilk eşleşen kova. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BucketAssignment {

    private String bucketLabel;
    private String segmentKey;
}
