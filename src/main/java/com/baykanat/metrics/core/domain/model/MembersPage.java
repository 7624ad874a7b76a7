package com.baykanat.metrics.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/** Sayfalanmış entity id listesi + toplam. */
@Data
@AllArgsConstructor
public class MembersPage {

    private List<String> items;
    private long total;

    public static MembersPage empty() {
        return new MembersPage(List.of(), 0);
    }
}
