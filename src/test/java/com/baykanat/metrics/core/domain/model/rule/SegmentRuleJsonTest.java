package com.baykanat.metrics.core.domain.model.rule;

import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.exception.UnsupportedCombinationException;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.ComparisonOp;
import com.baykanat.metrics.core.domain.model.DirectoryUser;
import com.baykanat.metrics.core.domain.model.UserAttribute;
import com.baykanat.metrics.core.domain.model.WindowPreset;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Rule JSON shape and rule-level validation. Rules are stored as JSONB with a "kind" discriminator.
 */
class SegmentRuleJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Threshold rule is read by kind with its table binding")
    void readsThresholdRule() throws Exception {
        String json = """
                {"kind":"metric_threshold","metricKey":"revenue","agg":"avg","window":"last_30_days",
                 "op":">=","value":100,
                 "table":{"tableId":"projects","columnKey":"tier","bucketLabel":"High","sortOrder":1}}
                """;

        SegmentRule rule = objectMapper.readValue(json, SegmentRule.class);

        assertThat(rule).isInstanceOf(MetricThresholdRule.class);
        MetricThresholdRule threshold = (MetricThresholdRule) rule;
        assertThat(threshold.getAgg()).isEqualTo(AggregationFunction.AVG);
        assertThat(threshold.getWindow()).isEqualTo(WindowPreset.LAST_30_DAYS);
        assertThat(threshold.getOp()).isEqualTo(ComparisonOp.GTE);
        assertThat(threshold.getValue()).isEqualByComparingTo("100");
        assertThat(threshold.isTableBound()).isTrue();
        assertThat(threshold.getTable().getSortOrder()).isEqualTo(1);
    }

    @Test
    @DisplayName("Written JSON carries the kind and omits absent fields")
    void writesKind() throws Exception {
        StaticEntityIdsRule rule = StaticEntityIdsRule.builder().entityIds(List.of("p1", "p2")).build();

        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(rule));

        assertThat(node.get("kind").asText()).isEqualTo("static_entity_ids");
        assertThat(node.get("entityIds")).hasSize(2);
        assertThat(node.has("table")).isFalse();
    }

    @Test
    @DisplayName("Unknown kind is rejected")
    void unknownKind() {
        assertThatThrownBy(() -> objectMapper.readValue("{\"kind\":\"magic\"}", SegmentRule.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    @DisplayName("Threshold without metricKey is invalid")
    void thresholdNeedsMetricKey() {
        MetricThresholdRule rule = MetricThresholdRule.builder()
                .op(ComparisonOp.GT).value(BigDecimal.ONE).build();

        assertThatThrownBy(() -> rule.validate("project"))
                .isInstanceOf(MetricsValidationException.class)
                .hasMessage("Missing rule.metricKey");
    }

    @Test
    @DisplayName("Entity attribute rule only supports users and equality operators")
    void entityAttributeValidation() {
        EntityAttributeRule rule = EntityAttributeRule.builder()
                .attribute(UserAttribute.EMAIL_VERIFIED).op(ComparisonOp.EQ).value(true).build();

        assertThatThrownBy(() -> rule.validate("project")).isInstanceOf(UnsupportedCombinationException.class);

        rule.setOp(ComparisonOp.GT);
        assertThatThrownBy(() -> rule.validate("user")).isInstanceOf(MetricsValidationException.class);

        rule.setOp(ComparisonOp.EQ);
        rule.setValue("yes");
        assertThatThrownBy(() -> rule.validate("user"))
                .hasMessage("rule.value must be a boolean for email_verified");
    }

    @Test
    @DisplayName("Entity attribute != matches users whose attribute differs")
    void entityAttributeNotEquals() {
        EntityAttributeRule rule = EntityAttributeRule.builder()
                .attribute(UserAttribute.ROLE).op(ComparisonOp.NE).value(" admin ").build();

        assertThat(rule.matches(DirectoryUser.builder().email("a@x.io").role("admin").build())).isFalse();
        assertThat(rule.matches(DirectoryUser.builder().email("b@x.io").role("member").build())).isTrue();
        assertThat(rule.matches(DirectoryUser.builder().email("c@x.io").build())).isTrue();
    }

    @Test
    @DisplayName("Table metric rule is read by kind with its display settings")
    void readsTableMetricRule() throws Exception {
        String json = """
                {"kind":"table_metric","metricKey":"revenue","agg":"count","window":"month_to_date",
                 "table":{"tableId":"projects","columnKey":"events","columnLabel":"Events","decimals":0}}
                """;

        SegmentRule rule = objectMapper.readValue(json, SegmentRule.class);

        assertThat(rule).isInstanceOf(TableMetricRule.class);
        TableMetricRule metric = (TableMetricRule) rule;
        assertThat(metric.effectiveAgg()).isEqualTo(AggregationFunction.COUNT);
        assertThat(metric.effectiveWindow()).isEqualTo(WindowPreset.MONTH_TO_DATE);
        assertThat(metric.getTable().getDecimals()).isZero();
        metric.validate("project");
    }

    @Test
    @DisplayName("Table metric rule needs a metric key and a table column")
    void tableMetricValidation() {
        TableMetricRule rule = TableMetricRule.builder().metricKey("revenue").build();
        assertThatThrownBy(() -> rule.validate("project"))
                .hasMessage("table_metric requires rule.table.tableId and rule.table.columnKey");

        rule.setTable(TableBinding.builder().tableId("projects").columnKey("revenue").decimals(13).build());
        assertThatThrownBy(() -> rule.validate("project"))
                .hasMessage("rule.table.decimals must be between 0 and 12");

        rule.setMetricKey(" ");
        assertThatThrownBy(() -> rule.validate("project"))
                .isInstanceOf(MetricsValidationException.class)
                .hasMessage("Missing rule.metricKey");
    }
}
