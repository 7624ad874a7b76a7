package com.baykanat.metrics.core.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Batch slotu: ya data+meta ya error. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchQueryResult {

    private List<Map<String, Object>> data;
    private QueryMeta meta;
    private String error;

    public static BatchQueryResult success(QueryResponse response) {
        return BatchQueryResult.builder().data(response.getData()).meta(response.getMeta()).build();
    }

    public static BatchQueryResult failure(String error) {
        return BatchQueryResult.builder().error(error).build();
    }
}
