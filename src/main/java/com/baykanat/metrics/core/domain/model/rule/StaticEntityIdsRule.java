package com.baykanat.metrics.core.domain.model.rule;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Sabit entity id listesi. */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class StaticEntityIdsRule extends SegmentRule {

    private List<String> entityIds;

    @Override
    public RuleKind ruleKind() {
        return RuleKind.STATIC_ENTITY_IDS;
    }

    @Override
    public void validate(String entityKind) {
        if (entityIds == null) {
            throw new MetricsValidationException("rule.entityIds must be an array");
        }
    }

    /** Trim edilmiş, boşları atılmış, sırası korunmuş tekil id'ler. */
    public Set<String> normalizedIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (entityIds != null) {
            entityIds.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(id -> !id.isEmpty())
                    .forEach(ids::add);
        }
        return ids;
    }
}
