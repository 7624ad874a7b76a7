package com.baykanat.metrics.core.integration;

import com.baykanat.metrics.core.api.dto.DrilldownRequest;
import com.baykanat.metrics.core.api.dto.DrilldownResponse;
import com.baykanat.metrics.core.api.dto.IngestPointsResponse;
import com.baykanat.metrics.core.api.dto.MetricPointRequest;
import com.baykanat.metrics.core.api.dto.MetricPointResponse;
import com.baykanat.metrics.core.api.dto.MetricQueryRequest;
import com.baykanat.metrics.core.api.dto.QueryResponse;
import com.baykanat.metrics.core.api.dto.RowContext;
import com.baykanat.metrics.core.domain.service.DrilldownService;
import com.baykanat.metrics.core.domain.service.MetricQueryService;
import com.baykanat.metrics.core.domain.service.PointIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end ingestion, aggregation and drilldown against a real PostgreSQL (Testcontainers).
 *
 * <p>JSONB dimension extraction, date_trunc bucketing and the ON CONFLICT upsert are
 * PostgreSQL-specific, so these paths are only verified here.
 */
@SpringBootTest
@Testcontainers
@EmbeddedKafka(partitions = 1, topics = {"metric-points-ingestion", "metric-points-ingestion.DLT"})
@ActiveProfiles("test")
class PointQueryIntegrationTest {

    private static final String DATA_SOURCE = "ds_integration";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("metrics_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private PointIngestionService ingestionService;

    @Autowired
    private MetricQueryService queryService;

    @Autowired
    private DrilldownService drilldownService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTables() {
        jdbcTemplate.execute("TRUNCATE metric_points, ingest_batches, sync_runs, data_sources CASCADE");
        jdbcTemplate.update("INSERT INTO data_sources (id, entity_kind, entity_id, connector_key, source_kind)"
                + " VALUES (?, 'project', 'p1', 'manual', 'upload')", DATA_SOURCE);
    }

    @Test
    @DisplayName("Re-ingesting the same identity updates the value instead of duplicating the point")
    void upsertIsIdempotent() {
        ingestionService.ingest(List.of(point("p1", "revenue", "2024-01-01", "10", Map.of("country", "TR"))));
        IngestPointsResponse second = ingestionService.ingest(List.of(
                point("p1", "revenue", "2024-01-01T00:00:00Z", "12", Map.of("country", "TR"))));

        assertThat(second.getIngested()).isEqualTo(1);
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM metric_points", Integer.class);
        BigDecimal value = jdbcTemplate.queryForObject("SELECT value FROM metric_points", BigDecimal.class);
        assertThat(count).isEqualTo(1);
        assertThat(value).isEqualByComparingTo("12");
    }

    @Test
    @DisplayName("Dimension key order does not create a new identity")
    void dimensionOrderIsIrrelevant() {
        ingestionService.ingest(List.of(
                point("p1", "revenue", "2024-01-01", "1", Map.of("country", "TR", "platform", "steam"))));
        ingestionService.ingest(List.of(
                point("p1", "revenue", "2024-01-01", "2", Map.of("platform", "steam", "country", "TR"))));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM metric_points", Integer.class);
        assertThat(count).isEqualTo(1);
    }

    @Test
    @DisplayName("Dimension maps that only look alike when flattened stay separate points")
    void distinctDimensionMapsStaySeparate() {
        ingestionService.ingest(List.of(point("p1", "revenue", "2024-01-01", "1", Map.of("a", "1|b:2"))));
        ingestionService.ingest(List.of(point("p1", "revenue", "2024-01-01", "2", Map.of("a", "1", "b", "2"))));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM metric_points", Integer.class);
        assertThat(count).isEqualTo(2);
    }

    @Test
    @DisplayName("Daily sum buckets points by day in ascending order")
    void dailySum() {
        seedRevenue();

        QueryResponse response = queryService.query(query("revenue", "day", "sum"));

        assertThat(response.getData()).hasSize(2);
        assertThat(response.getData().get(0).get("bucket")).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat((BigDecimal) response.getData().get(0).get("value")).isEqualByComparingTo("15");
        assertThat((BigDecimal) response.getData().get(1).get("value")).isEqualByComparingTo("7");
    }

    @Test
    @DisplayName("groupBy splits rows by dimension value")
    void groupByDimension() {
        seedRevenue();
        MetricQueryRequest request = query("revenue", "none", "sum");
        request.setGroupBy(List.of("country"));

        QueryResponse response = queryService.query(request);

        assertThat(response.getData()).hasSize(2);
        Map<String, Object> tr = response.getData().get(0);
        assertThat(tr.get("country")).isEqualTo("TR");
        assertThat((BigDecimal) tr.get("value")).isEqualByComparingTo("17");
        assertThat(tr).doesNotContainKey("bucket");
    }

    @Test
    @DisplayName("last returns the value of the latest point in the range")
    void lastAggregation() {
        ingestionService.ingest(List.of(
                point("p1", "balance", "2024-01-01", "4", null),
                point("p1", "balance", "2024-01-03", "9", null),
                point("p1", "balance", "2024-01-02", "6", null)));

        QueryResponse response = queryService.query(query("balance", "none", "last"));

        assertThat(response.getData()).hasSize(1);
        assertThat((BigDecimal) response.getData().get(0).get("value")).isEqualByComparingTo("9");
    }

    @Test
    @DisplayName("last with a day bucket picks the latest point inside each day")
    void lastPerDayBucket() {
        ingestionService.ingest(List.of(
                point("p1", "balance", "2024-01-02T08:00:00Z", "3", null),
                point("p1", "balance", "2024-01-02T20:00:00Z", "9", null),
                point("p1", "balance", "2024-01-03T10:00:00Z", "5", null)));

        QueryResponse response = queryService.query(query("balance", "day", "last"));

        assertThat(response.getData()).hasSize(2);
        assertThat(response.getData().get(0).get("bucket")).isEqualTo(Instant.parse("2024-01-02T00:00:00Z"));
        assertThat((BigDecimal) response.getData().get(0).get("value")).isEqualByComparingTo("9");
        assertThat(response.getData().get(1).get("bucket")).isEqualTo(Instant.parse("2024-01-03T00:00:00Z"));
        assertThat((BigDecimal) response.getData().get(1).get("value")).isEqualByComparingTo("5");
    }

    @Test
    @DisplayName("Drilldown from a week row covers the whole Monday-based week and nothing after it")
    void drilldownFromWeekRow() {
        ingestionService.ingest(List.of(
                point("p1", "revenue", "2024-01-01", "10", Map.of("country", "TR")),
                point("p1", "revenue", "2024-01-07T23:00:00Z", "2", Map.of("country", "TR")),
                point("p1", "revenue", "2024-01-08", "4", Map.of("country", "TR"))));
        MetricQueryRequest base = query("revenue", "week", "sum", "2024-01-01T00:00:00Z", "2024-01-15T00:00:00Z");
        base.setGroupBy(List.of("country"));

        QueryResponse aggregated = queryService.query(base);
        DrilldownResponse response = drilldownService.drilldown(DrilldownRequest.builder()
                .baseQuery(base)
                .rowContext(RowContext.builder()
                        .bucket("2024-01-01T00:00:00Z")
                        .dimensions(Map.of("country", "TR"))
                        .build())
                .build());

        assertThat(aggregated.getData()).hasSize(2);
        assertThat((BigDecimal) aggregated.getData().get(0).get("value")).isEqualByComparingTo("12");
        assertThat(response.getPagination().getTotal()).isEqualTo(2);
        assertThat(response.getPoints()).extracting(MetricPointResponse::getValue)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactlyInAnyOrder(new BigDecimal("10"), new BigDecimal("2"));
    }

    @Test
    @DisplayName("Drilldown from a month row follows the calendar month boundary")
    void drilldownFromMonthRow() {
        ingestionService.ingest(List.of(
                point("p1", "signups", "2024-01-31T23:00:00Z", "3", null),
                point("p1", "signups", "2024-02-01T00:00:00Z", "5", null),
                point("p1", "signups", "2024-02-29T12:00:00Z", "1", null)));
        MetricQueryRequest base = query("signups", "month", "sum", "2024-01-01T00:00:00Z", "2024-03-01T00:00:00Z");

        QueryResponse aggregated = queryService.query(base);
        DrilldownResponse response = drilldownService.drilldown(DrilldownRequest.builder()
                .baseQuery(base)
                .rowContext(RowContext.builder().bucket("2024-02-01T00:00:00Z").build())
                .build());

        assertThat(aggregated.getData()).hasSize(2);
        assertThat((BigDecimal) aggregated.getData().get(1).get("value")).isEqualByComparingTo("6");
        assertThat(response.getPagination().getTotal()).isEqualTo(2);
        assertThat(response.getPoints()).extracting(MetricPointResponse::getValue)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactlyInAnyOrder(new BigDecimal("5"), new BigDecimal("1"));
    }

    @Test
    @DisplayName("Drilldown from an aggregate row returns exactly the points behind it")
    void drilldownFromRow() {
        seedRevenue();
        MetricQueryRequest base = query("revenue", "day", "sum");
        base.setGroupBy(List.of("country"));

        DrilldownResponse response = drilldownService.drilldown(DrilldownRequest.builder()
                .baseQuery(base)
                .rowContext(RowContext.builder()
                        .bucket("2024-01-01T00:00:00Z")
                        .dimensions(Map.of("country", "TR"))
                        .build())
                .includeContributors(true)
                .build());

        assertThat(response.getPagination().getTotal()).isEqualTo(1);
        assertThat(response.getPoints()).hasSize(1);
        assertThat(response.getPoints().get(0).getValue()).isEqualByComparingTo("10");
        assertThat(response.getMeta().getDerivedFrom().getRowBucket()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(response.getContributors().getByDimension().getKey()).isEqualTo("country");
    }

    private void seedRevenue() {
        ingestionService.ingest(List.of(
                point("p1", "revenue", "2024-01-01", "10", Map.of("country", "TR")),
                point("p1", "revenue", "2024-01-01", "5", Map.of("country", "US")),
                point("p1", "revenue", "2024-01-02", "7", Map.of("country", "TR"))));
    }

    private static MetricQueryRequest query(String metricKey, String bucket, String agg) {
        return query(metricKey, bucket, agg, "2024-01-01T00:00:00Z", "2024-01-05T00:00:00Z");
    }

    private static MetricQueryRequest query(String metricKey, String bucket, String agg, String start, String end) {
        return MetricQueryRequest.builder()
                .metricKey(metricKey)
                .entityKind("project")
                .start(start)
                .end(end)
                .bucket(bucket)
                .agg(agg)
                .build();
    }

    private static MetricPointRequest point(String entityId, String metricKey, String date, String value,
                                            Map<String, Object> dimensions) {
        return MetricPointRequest.builder()
                .entityKind("project")
                .entityId(entityId)
                .metricKey(metricKey)
                .dataSourceId(DATA_SOURCE)
                .date(date)
                .value(value)
                .dimensions(dimensions)
                .build();
    }
}
