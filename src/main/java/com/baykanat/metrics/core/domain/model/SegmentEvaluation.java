package com.baykanat.metrics.core.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/** Tek entity üyelik sonucu; value sadece metric_threshold için dolu. */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class SegmentEvaluation {

    private boolean matches;
    private BigDecimal value;
    private String reason;

    public static SegmentEvaluation of(boolean matches) {
        return SegmentEvaluation.builder().matches(matches).build();
    }

    public static SegmentEvaluation inactive() {
        return SegmentEvaluation.builder().matches(false).reason("inactive").build();
    }
}
