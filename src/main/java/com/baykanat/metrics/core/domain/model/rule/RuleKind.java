package com.baykanat.metrics.core.domain.model.rule;

import com.fasterxml.jackson.annotation.JsonValue;

/** Segment kural türü; JSON'daki "kind" alanı. */
public enum RuleKind {
    STATIC_ENTITY_IDS("static_entity_ids"),
    ALL_ENTITIES("all_entities"),
    ENTITY_ATTRIBUTE("entity_attribute"),
    METRIC_THRESHOLD("metric_threshold"),
    TABLE_METRIC("table_metric");

    private final String code;

    RuleKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
