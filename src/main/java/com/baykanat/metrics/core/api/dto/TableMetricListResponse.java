package com.baykanat.metrics.core.api.dto;

import com.baykanat.metrics.core.domain.model.TableMetricColumn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableMetricListResponse {

    private String tableId;
    private String entityKind;
    private List<TableMetricColumn> columns;
}
