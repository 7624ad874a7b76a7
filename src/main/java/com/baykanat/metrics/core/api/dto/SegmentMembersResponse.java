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
public class SegmentMembersResponse {

    private List<String> items;
    private long total;
    private int page;
    private int pageSize;
}
