package com.baykanat.metrics.core.domain.service;

import com.baykanat.metrics.core.config.AppProperties;
import com.baykanat.metrics.core.domain.exception.MetricsValidationException;
import com.baykanat.metrics.core.domain.exception.NotFoundException;
import com.baykanat.metrics.core.domain.exception.UnsupportedCombinationException;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.DirectoryUser;
import com.baykanat.metrics.core.domain.model.MembersPage;
import com.baykanat.metrics.core.domain.model.PointFilter;
import com.baykanat.metrics.core.domain.model.Segment;
import com.baykanat.metrics.core.domain.model.SegmentEvaluation;
import com.baykanat.metrics.core.domain.model.TimeRange;
import com.baykanat.metrics.core.domain.model.rule.EntityAttributeRule;
import com.baykanat.metrics.core.domain.model.rule.MetricThresholdRule;
import com.baykanat.metrics.core.domain.model.rule.SegmentRule;
import com.baykanat.metrics.core.domain.model.rule.StaticEntityIdsRule;
import com.baykanat.metrics.core.infrastructure.directory.UserDirectory;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentJdbcRepository;
import com.baykanat.metrics.core.infrastructure.persistence.SegmentMetricJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Segment kurallarını üç erişim şekliyle değerlendirir: tek entity, sayfalı üye listesi ve aday id kümesi (tek sorgu).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentRuleEvaluator {

    private final SegmentJdbcRepository segmentRepository;
    private final SegmentMetricJdbcRepository segmentMetricRepository;
    private final UserDirectory userDirectory;
    private final WindowResolver windowResolver;
    private final AppProperties appProperties;

    public SegmentEvaluation evaluate(String segmentKey, String entityKind, String entityId) {
        Segment segment = requireSegment(segmentKey, entityKind);
        if (!segment.isActive()) {
            return SegmentEvaluation.inactive();
        }
        SegmentRule rule = segment.getRule();
        rule.validate(entityKind);
        String id = entityId.trim();

        SegmentEvaluation result = switch (rule.ruleKind()) {
            case STATIC_ENTITY_IDS -> SegmentEvaluation.of(((StaticEntityIdsRule) rule).normalizedIds().contains(id));
            case ALL_ENTITIES -> SegmentEvaluation.of(lookupUser(id).isPresent());
            case ENTITY_ATTRIBUTE -> SegmentEvaluation.of(
                    lookupUser(id).map(((EntityAttributeRule) rule)::matches).orElse(false));
            case METRIC_THRESHOLD -> evaluateThreshold((MetricThresholdRule) rule, entityKind, id);
            case TABLE_METRIC -> throw notMembershipRule(segmentKey);
        };
        log.debug("Segment evaluated: key={}, entityKind={}, entityId={}, matches={}",
                segmentKey, entityKind, id, result.isMatches());
        return result;
    }

    /** Kurala uyan entity id'leri artan sırada; pasif segment boş sayfa döner. */
    public MembersPage members(String segmentKey, String entityKind, int page, int pageSize) {
        int maxPageSize = appProperties.getSegments().getMaxPageSize();
        if (page < 1) {
            throw new MetricsValidationException("page must be >= 1");
        }
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw new MetricsValidationException("pageSize must be between 1 and " + maxPageSize);
        }
        Segment segment = requireSegment(segmentKey, entityKind);
        if (!segment.isActive()) {
            return MembersPage.empty();
        }
        SegmentRule rule = segment.getRule();
        rule.validate(entityKind);
        long offset = (long) (page - 1) * pageSize;

        return switch (rule.ruleKind()) {
            case STATIC_ENTITY_IDS -> {
                List<String> ids = ((StaticEntityIdsRule) rule).normalizedIds().stream().sorted().toList();
                int from = (int) Math.min(offset, ids.size());
                int to = Math.min(from + pageSize, ids.size());
                yield new MembersPage(ids.subList(from, to), ids.size());
            }
            case ALL_ENTITIES -> userDirectory.pageEmails(null, pageSize, offset);
            case ENTITY_ATTRIBUTE -> userDirectory.pageEmails((EntityAttributeRule) rule, pageSize, offset);
            case METRIC_THRESHOLD -> {
                MetricThresholdRule threshold = (MetricThresholdRule) rule;
                yield segmentMetricRepository.matchingPage(thresholdFilter(threshold, entityKind).build(),
                        threshold.effectiveAgg(), threshold.getOp(), threshold.getValue(), pageSize, offset);
            }
            case TABLE_METRIC -> throw notMembershipRule(segmentKey);
        };
    }

    /**
     * Aday id'lerden segmente uyanlar. Kural türü başına tek sorgu; sonuç aday sırasını korur.
     * Pasif segment hiçbir id döndürmez.
     */
    public Set<String> matchingIds(Segment segment, String entityKind, Collection<String> entityIds) {
        if (!segment.isActive() || entityIds.isEmpty()) {
            return Set.of();
        }
        SegmentRule rule = segment.getRule();
        rule.validate(entityKind);

        return switch (rule.ruleKind()) {
            case STATIC_ENTITY_IDS -> {
                Set<String> members = ((StaticEntityIdsRule) rule).normalizedIds();
                yield entityIds.stream().filter(members::contains)
                        .collect(Collectors.toCollection(LinkedHashSet::new));
            }
            case ALL_ENTITIES -> matchUsers(entityIds, user -> true);
            case ENTITY_ATTRIBUTE -> matchUsers(entityIds, ((EntityAttributeRule) rule)::matches);
            case METRIC_THRESHOLD -> matchThreshold((MetricThresholdRule) rule, entityKind, entityIds);
            case TABLE_METRIC -> throw notMembershipRule(segment.getKey());
        };
    }

    /** Key ile segment; yoksa 404, entityKind uyuşmazsa 400. */
    public Segment requireSegment(String segmentKey, String entityKind) {
        Segment segment = segmentRepository.findByKey(segmentKey)
                .orElseThrow(() -> new NotFoundException("Segment not found: " + segmentKey));
        if (!segment.getEntityKind().equals(entityKind)) {
            throw new MetricsValidationException("Segment entityKind mismatch (segment=" + segment.getEntityKind()
                    + ", request=" + entityKind + ")");
        }
        return segment;
    }

    private static UnsupportedCombinationException notMembershipRule(String segmentKey) {
        return new UnsupportedCombinationException(
                "Segment " + segmentKey + " is a table_metric column and has no members");
    }

    private SegmentEvaluation evaluateThreshold(MetricThresholdRule rule, String entityKind, String entityId) {
        AggregationFunction agg = rule.effectiveAgg();
        PointFilter filter = thresholdFilter(rule, entityKind).entityId(entityId).build();
        Optional<BigDecimal> aggregated = segmentMetricRepository.aggregateForEntity(filter, agg);
        if (aggregated.isEmpty() && !agg.defaultsToZeroWhenAbsent()) {
            return SegmentEvaluation.of(false);
        }
        BigDecimal value = aggregated.orElse(BigDecimal.ZERO);
        return SegmentEvaluation.builder()
                .matches(rule.getOp().test(value, rule.getValue()))
                .value(value)
                .build();
    }

    private Set<String> matchThreshold(MetricThresholdRule rule, String entityKind, Collection<String> entityIds) {
        AggregationFunction agg = rule.effectiveAgg();
        PointFilter filter = thresholdFilter(rule, entityKind).entityIds(new ArrayList<>(entityIds)).build();
        Map<String, BigDecimal> values = segmentMetricRepository.aggregateByEntity(filter, agg);

        Set<String> matched = new LinkedHashSet<>();
        for (String entityId : entityIds) {
            BigDecimal value = values.get(entityId);
            if (value == null) {
                if (!agg.defaultsToZeroWhenAbsent()) {
                    continue;
                }
                value = BigDecimal.ZERO;
            }
            if (rule.getOp().test(value, rule.getValue())) {
                matched.add(entityId);
            }
        }
        return matched;
    }

    private PointFilter.PointFilterBuilder thresholdFilter(MetricThresholdRule rule, String entityKind) {
        TimeRange range = windowResolver.resolve(rule);
        return PointFilter.builder()
                .metricKey(rule.getMetricKey().trim())
                .entityKind(entityKind)
                .start(range.getStart())
                .end(range.getEnd());
    }

    private Optional<DirectoryUser> lookupUser(String entityId) {
        return userDirectory.findByEmails(List.of(entityId.toLowerCase(Locale.ROOT))).stream().findFirst();
    }

    /** Dizin karşılaştırması küçük harf email ile; dönen küme orijinal id'leri içerir. */
    private Set<String> matchUsers(Collection<String> entityIds, Predicate<DirectoryUser> predicate) {
        Set<String> lowered = entityIds.stream()
                .map(id -> id.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> matchedEmails = userDirectory.findByEmails(lowered).stream()
                .filter(predicate)
                .map(DirectoryUser::getEmail)
                .collect(Collectors.toSet());
        return entityIds.stream()
                .filter(id -> matchedEmails.contains(id.trim().toLowerCase(Locale.ROOT)))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
