package com.baykanat.metrics.core.domain.model.rule;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.exception.UnsupportedCombinationException;
import com.baykanat.metrics.core.domain.model.ComparisonOp;
import com.baykanat.metrics.core.domain.model.DirectoryUser;
import com.baykanat.metrics.core.domain.model.UserAttribute;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.Objects;

/** Kullanıcı attribute eşitlik kuralı (role, email_verified, locked); sadece == ve !=. */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class EntityAttributeRule extends SegmentRule {

    private UserAttribute attribute;
    private ComparisonOp op;
    private Object value;

    @Override
    public RuleKind ruleKind() {
        return RuleKind.ENTITY_ATTRIBUTE;
    }

    @Override
    public void validate(String entityKind) {
        if (!USER_ENTITY_KIND.equals(entityKind)) {
            throw new UnsupportedCombinationException("entity_attribute is only supported for entityKind=user");
        }
        if (attribute == null) {
            throw new MetricsValidationException("Missing rule.attribute");
        }
        if (op == null || !op.isEquality()) {
            throw new MetricsValidationException("rule.op must be == or != for entity_attribute");
        }
        expectedValue();
    }

    /** Attribute tipine göre normalize edilmiş beklenen değer (role → trim'li String, diğerleri Boolean). */
    public Object expectedValue() {
        if (attribute.isBoolean()) {
            if (!(value instanceof Boolean)) {
                throw new MetricsValidationException("rule.value must be a boolean for " + attribute.code());
            }
            return value;
        }
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new MetricsValidationException("rule.value must be a non-empty string for " + attribute.code());
        }
        return ((String) value).trim();
    }

    /** Kullanıcı kaydı kurala uyuyor mu. */
    public boolean matches(DirectoryUser user) {
        Object actual = switch (attribute) {
            case ROLE -> user.getRole();
            case EMAIL_VERIFIED -> user.isEmailVerified();
            case LOCKED -> user.isLocked();
        };
        boolean equal = Objects.equals(actual, expectedValue());
        return op == ComparisonOp.EQ ? equal : !equal;
    }
}
