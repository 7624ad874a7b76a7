package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.exception.NotFoundException;
import com.baykanat.metrics.core.domain.exception.UnsupportedCombinationException;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.ComparisonOp;
import com.baykanat.metrics.core.domain.model.DirectoryUser;
import com.baykanat.metrics.core.domain.model.MembersPage;
import com.baykanat.metrics.core.domain.model.PointFilter;
import com.baykanat.metrics.core.domain.model.Segment;
import com.baykanat.metrics.core.domain.model.SegmentEvaluation;
import com.baykanat.metrics.core.domain.model.UserAttribute;
import com.baykanat.metrics.core.domain.model.WindowPreset;
import com.baykanat.metrics.core.domain.model.rule.AllEntitiesRule;
import com.baykanat.metrics.core.domain.model.rule.EntityAttributeRule;
import com.baykanat.metrics.core.domain.model.rule.MetricThresholdRule;
import com.baykanat.metrics.core.domain.model.rule.SegmentRule;
import com.baykanat.metrics.core.domain.model.rule.StaticEntityIdsRule;
import com.baykanat.metrics.core.domain.model.rule.TableBinding;
import com.baykanat.metrics.core.domain.model.rule.TableMetricRule;
import com.baykanat.metrics.core.infrastructure.directory.UserDirectory;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentJdbcRepository;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentMetricJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SegmentRuleEvaluator.
 *
 * <p>Covers every rule kind across the single, paged and batch access patterns, including the
 * zero-default asymmetry of metric thresholds: sum/count/last treat "no points" as 0 while
 * avg/min/max leave the entity out.
 */
@ExtendWith(MockitoExtension.class)
class SegmentRuleEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-05-20T12:00:00Z");

    @Mock
    private SegmentJdbcRepository segmentRepository;

    @Mock
    private SegmentMetricJdbcRepository segmentMetricRepository;

    @Mock
    private UserDirectory userDirectory;

    private SegmentRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new SegmentRuleEvaluator(segmentRepository, segmentMetricRepository, userDirectory,
                new WindowResolver(Clock.fixed(NOW, ZoneOffset.UTC)), new AppProperties());
    }

    @Test
    @DisplayName("Evaluate - unknown segment key is not found")
    void unknownSegment() {
        when(segmentRepository.findByKey("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> evaluator.evaluate("missing", "project", "p1"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Evaluate - entityKind different from the segment's is rejected")
    void entityKindMismatch() {
        stubSegment("s", "project", staticIds("p1"), true);

        assertThatThrownBy(() -> evaluator.evaluate("s", "user", "p1"))
                .isInstanceOf(MetricsValidationException.class)
                .hasMessageContaining("entityKind mismatch");
    }

    @Test
    @DisplayName("Evaluate - inactive segment never matches")
    void inactiveSegment() {
        stubSegment("s", "project", staticIds("p1"), false);

        SegmentEvaluation result = evaluator.evaluate("s", "project", "p1");

        assertThat(result.isMatches()).isFalse();
        assertThat(result.getReason()).isEqualTo("inactive");
    }

    @Test
    @DisplayName("Static ids - membership iff id is in the list")
    void staticIds() {
        stubSegment("s", "project", staticIds("p1", " p2 "), true);

        assertThat(evaluator.evaluate("s", "project", "p2").isMatches()).isTrue();
        assertThat(evaluator.evaluate("s", "project", "p3").isMatches()).isFalse();
    }

    @Test
    @DisplayName("Static ids - member listing is sorted and paged")
    void staticIdsPaging() {
        stubSegment("s", "project", staticIds("c", "a", "b"), true);

        MembersPage page = evaluator.members("s", "project", 2, 2);

        assertThat(page.getItems()).containsExactly("c");
        assertThat(page.getTotal()).isEqualTo(3);
    }

    @Test
    @DisplayName("All entities - only supported for users")
    void allEntitiesNeedsUser() {
        stubSegment("s", "project", new AllEntitiesRule(), true);

        assertThatThrownBy(() -> evaluator.evaluate("s", "project", "p1"))
                .isInstanceOf(UnsupportedCombinationException.class);
    }

    @Test
    @DisplayName("Table metric - a computed column segment has no members")
    void tableMetricHasNoMembers() {
        TableMetricRule rule = TableMetricRule.builder()
                .metricKey("revenue")
                .table(TableBinding.builder().tableId("projects").columnKey("revenue").build())
                .build();
        stubSegment("s", "project", rule, true);

        assertThatThrownBy(() -> evaluator.evaluate("s", "project", "p1"))
                .isInstanceOf(UnsupportedCombinationException.class)
                .hasMessage("Segment s is a table_metric column and has no members");
        assertThatThrownBy(() -> evaluator.members("s", "project", 1, 10))
                .isInstanceOf(UnsupportedCombinationException.class);
        verifyNoInteractions(segmentMetricRepository);
    }

    @Test
    @DisplayName("All entities - membership iff the user exists in the directory, case-insensitive")
    void allEntitiesLooksUpDirectory() {
        stubSegment("s", "user", new AllEntitiesRule(), true);
        when(userDirectory.findByEmails(List.of("ada@example.com")))
                .thenReturn(List.of(user("ada@example.com", "admin", true, false)));

        assertThat(evaluator.evaluate("s", "user", "Ada@Example.com").isMatches()).isTrue();
    }

    @Test
    @DisplayName("Entity attribute - compares the looked-up attribute")
    void entityAttribute() {
        EntityAttributeRule rule = EntityAttributeRule.builder()
                .attribute(UserAttribute.ROLE).op(ComparisonOp.EQ).value("admin").build();
        when(userDirectory.findByEmails(anyCollection())).thenReturn(List.of(
                user("ada@example.com", "admin", true, false),
                user("bob@example.com", "member", true, false)));

        Set<String> matched = evaluator.matchingIds(segment("s", "user", rule, true), "user",
                List.of("ADA@example.com", "bob@example.com", "nobody@example.com"));

        assertThat(matched).containsExactly("ADA@example.com");
    }

    @Test
    @DisplayName("Entity attribute - unknown user does not match")
    void entityAttributeUnknownUser() {
        EntityAttributeRule rule = EntityAttributeRule.builder()
                .attribute(UserAttribute.LOCKED).op(ComparisonOp.NE).value(true).build();
        stubSegment("s", "user", rule, true);
        when(userDirectory.findByEmails(anyCollection())).thenReturn(List.of());

        assertThat(evaluator.evaluate("s", "user", "ghost@example.com").isMatches()).isFalse();
    }

    @Test
    @DisplayName("Threshold - entity without points matches sum < 100 (value 0)")
    void sumDefaultsToZero() {
        stubSegment("s", "project", threshold(AggregationFunction.SUM, ComparisonOp.LT, "100"), true);
        when(segmentMetricRepository.aggregateForEntity(any(PointFilter.class), eq(AggregationFunction.SUM)))
                .thenReturn(Optional.empty());

        SegmentEvaluation result = evaluator.evaluate("s", "project", "p1");

        assertThat(result.isMatches()).isTrue();
        assertThat(result.getValue()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Threshold - entity without points does not match avg > 0 (excluded)")
    void avgExcludesAbsentEntity() {
        stubSegment("s", "project", threshold(AggregationFunction.AVG, ComparisonOp.GT, "0"), true);
        when(segmentMetricRepository.aggregateForEntity(any(PointFilter.class), eq(AggregationFunction.AVG)))
                .thenReturn(Optional.empty());

        SegmentEvaluation result = evaluator.evaluate("s", "project", "p1");

        assertThat(result.isMatches()).isFalse();
        assertThat(result.getValue()).isNull();
    }

    @Test
    @DisplayName("Threshold - filter carries metric, entity and resolved window")
    void thresholdFilter() {
        MetricThresholdRule rule = threshold(AggregationFunction.SUM, ComparisonOp.GTE, "10");
        rule.setWindow(WindowPreset.LAST_7_DAYS);
        stubSegment("s", "project", rule, true);
        when(segmentMetricRepository.aggregateForEntity(any(PointFilter.class), eq(AggregationFunction.SUM)))
                .thenReturn(Optional.of(new BigDecimal("10.0000")));

        SegmentEvaluation result = evaluator.evaluate("s", "project", "p1");

        ArgumentCaptor<PointFilter> captor = ArgumentCaptor.forClass(PointFilter.class);
        verify(segmentMetricRepository).aggregateForEntity(captor.capture(), eq(AggregationFunction.SUM));
        PointFilter filter = captor.getValue();
        assertThat(filter.getMetricKey()).isEqualTo("revenue");
        assertThat(filter.getEntityKind()).isEqualTo("project");
        assertThat(filter.getEntityId()).isEqualTo("p1");
        assertThat(filter.getStart()).isEqualTo(Instant.parse("2024-05-13T12:00:00Z"));
        assertThat(filter.getEnd()).isEqualTo(NOW);
        assertThat(result.isMatches()).isTrue();
    }

    @Test
    @DisplayName("Threshold batch - one query for all candidates with the zero-default asymmetry")
    void thresholdBatch() {
        Map<String, BigDecimal> values = Map.of("p1", new BigDecimal("50"), "p2", new BigDecimal("500"));
        when(segmentMetricRepository.aggregateByEntity(any(PointFilter.class), any(AggregationFunction.class)))
                .thenReturn(values);

        Segment sumBelow = segment("sum_lt", "project", threshold(AggregationFunction.SUM, ComparisonOp.LT, "100"), true);
        Segment minAbove = segment("min_gt", "project", threshold(AggregationFunction.MIN, ComparisonOp.GT, "0"), true);

        assertThat(evaluator.matchingIds(sumBelow, "project", List.of("p1", "p2", "p3")))
                .containsExactly("p1", "p3");
        assertThat(evaluator.matchingIds(minAbove, "project", List.of("p1", "p2", "p3")))
                .containsExactly("p1", "p2");
        verify(segmentMetricRepository, times(2)).aggregateByEntity(any(PointFilter.class), any(AggregationFunction.class));
    }

    @Test
    @DisplayName("Members - page size above the maximum is rejected")
    void pageSizeLimit() {
        assertThatThrownBy(() -> evaluator.members("s", "project", 1, 501))
                .isInstanceOf(MetricsValidationException.class);
        verifyNoInteractions(segmentRepository);
    }

    @Test
    @DisplayName("Members - threshold listing delegates to the paged matching query")
    void thresholdMembers() {
        MetricThresholdRule rule = threshold(AggregationFunction.COUNT, ComparisonOp.GTE, "1");
        stubSegment("s", "project", rule, true);
        when(segmentMetricRepository.matchingPage(any(PointFilter.class), eq(AggregationFunction.COUNT),
                eq(ComparisonOp.GTE), eq(new BigDecimal("1")), eq(25), eq(25L)))
                .thenReturn(new MembersPage(List.of("p9"), 26));

        MembersPage page = evaluator.members("s", "project", 2, 25);

        assertThat(page.getItems()).containsExactly("p9");
        assertThat(page.getTotal()).isEqualTo(26);
    }

    private void stubSegment(String key, String entityKind, SegmentRule rule, boolean active) {
        when(segmentRepository.findByKey(key)).thenReturn(Optional.of(segment(key, entityKind, rule, active)));
    }

    private static Segment segment(String key, String entityKind, SegmentRule rule, boolean active) {
        return Segment.builder().id("seg_" + key).key(key).entityKind(entityKind).label(key)
                .rule(rule).active(active).build();
    }

    private static StaticEntityIdsRule staticIds(String... ids) {
        return StaticEntityIdsRule.builder().entityIds(List.of(ids)).build();
    }

    private static MetricThresholdRule threshold(AggregationFunction agg, ComparisonOp op, String value) {
        return MetricThresholdRule.builder()
                .metricKey("revenue")
                .agg(agg)
                .op(op)
                .value(new BigDecimal(value))
                .build();
    }

    private static DirectoryUser user(String email, String role, boolean verified, boolean locked) {
        return DirectoryUser.builder().email(email).role(role).emailVerified(verified).locked(locked).build();
    }
}
