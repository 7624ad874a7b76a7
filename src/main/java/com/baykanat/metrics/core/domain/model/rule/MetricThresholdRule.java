package com.baykanat.metrics.core.domain.model.rule;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.ComparisonOp;
import com.baykanat.metrics.core.domain.model.Timestamps;
import com.baykanat.metrics.core.domain.model.WindowPreset;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.Instant;

/** Pencere içindeki metrik toplamı eşik ile karşılaştırır; her entityKind için geçerli. */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class MetricThresholdRule extends SegmentRule {

    private String metricKey;
    private AggregationFunction agg;
    private WindowPreset window;
    private String start;
    private String end;
    private ComparisonOp op;
    private BigDecimal value;

    @Override
    public RuleKind ruleKind() {
        return RuleKind.METRIC_THRESHOLD;
    }

    @Override
    public void validate(String entityKind) {
        if (metricKey == null || metricKey.isBlank()) {
            throw new MetricsValidationException("Missing rule.metricKey");
        }
        if (op == null) {
            throw new MetricsValidationException("Missing rule.op");
        }
        if (value == null) {
            throw new MetricsValidationException("Invalid rule.value");
        }
        Timestamps.requireOrdered("rule.end", "rule.start", explicitStart(), explicitEnd());
    }

    /** Boşsa sum. */
    @JsonIgnore
    public AggregationFunction effectiveAgg() {
        return agg != null ? agg : AggregationFunction.SUM;
    }

    @JsonIgnore
    public Instant explicitStart() {
        return Timestamps.parseOptional("rule.start", start);
    }

    @JsonIgnore
    public Instant explicitEnd() {
        return Timestamps.parseOptional("rule.end", end);
    }

    /** Açık start/end verilmiş mi (preset'ten önceliklidir). */
    @JsonIgnore
    public boolean hasExplicitRange() {
        return (start != null && !start.isBlank()) || (end != null && !end.isBlank());
    }
}
