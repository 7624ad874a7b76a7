package com.baykanat.metrics.core.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** results[i] ↔ queries[i]. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchQueryResponse {

    private List<BatchQueryResult> results;
}
