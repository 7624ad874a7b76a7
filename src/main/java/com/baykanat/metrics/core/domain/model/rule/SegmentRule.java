package com.baykanat.metrics.core.domain.model.rule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Segment üyelik kuralı. JSONB'de "kind" alanı ile saklanır; bilinmeyen kind deserialize sırasında reddedilir.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "kind", visible = false)
@JsonSubTypes({
        @JsonSubTypes.Type(value = StaticEntityIdsRule.class, name = "static_entity_ids"),
        @JsonSubTypes.Type(value = AllEntitiesRule.class, name = "all_entities"),
        @JsonSubTypes.Type(value = EntityAttributeRule.class, name = "entity_attribute"),
        @JsonSubTypes.Type(value = MetricThresholdRule.class, name = "metric_threshold"),
        @JsonSubTypes.Type(value = TableMetricRule.class, name = "table_metric")
})
public abstract class SegmentRule {

    public static final String USER_ENTITY_KIND = "user";

    private TableBinding table;

    /** JSON'a yazılan tür alanı. */
    public RuleKind getKind() {
        return ruleKind();
    }

    @JsonIgnore
    public abstract RuleKind ruleKind();

    /** Kural gövdesini ve entityKind ile uyumunu doğrular. */
    public abstract void validate(String entityKind);

    /** Kovaya bağlıysa etiket. */
    @JsonIgnore
    public boolean isTableBound() {
        return table != null && table.getTableId() != null && table.getColumnKey() != null;
    }
}
