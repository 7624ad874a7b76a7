package com.baykanat.metrics.core.domain.model.rule;

import com.baykanat.metrics.core.domain.exception.UnsupportedCombinationException;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/** Dizindeki tüm kullanıcılar; sadece entityKind=user. */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class AllEntitiesRule extends SegmentRule {

    @Override
    public RuleKind ruleKind() {
        return RuleKind.ALL_ENTITIES;
    }

    @Override
    public void validate(String entityKind) {
        if (!USER_ENTITY_KIND.equals(entityKind)) {
            throw new UnsupportedCombinationException("all_entities is only supported for entityKind=user");
        }
    }
}
