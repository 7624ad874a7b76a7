package com.baykanat.metrics.core.api.dto;

import com.baykanat.metrics.core.domain.model.BucketAssignment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** entityId → ilk eşleşen kova; hiçbirine uymayan id için null. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableBucketEvaluateResponse {

    private Map<String, BucketAssignment> values;
}
