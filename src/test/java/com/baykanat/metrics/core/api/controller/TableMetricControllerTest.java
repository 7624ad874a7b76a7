package com.baykanat.metrics.core.api.controller;

import com.baykanat.metrics.core.api.dto.TableMetricListResponse;
import com.baykanat.metrics.core.domain.exception.NotFoundException;
import com.baykanat.metrics.core.domain.model.AggregationFunction;
import com.baykanat.metrics.core.domain.model.TableMetricColumn;
import com.baykanat.metrics.core.domain.model.WindowPreset;
import com.baykanat.metrics.core.domain.service.TableMetricService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TableMetricController.class)
class TableMetricControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private TableMetricService tableMetricService;

    @Test
    @DisplayName("POST /segments/table-metrics/evaluate - returns the value per entity")
    void evaluateReturnsValues() throws Exception {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        values.put("p1", new BigDecimal("12.5"));
        values.put("p2", BigDecimal.ZERO);
        when(tableMetricService.evaluate("projects", "revenue", "project", List.of("p1", "p2"))).thenReturn(values);

        mockMvc.perform(post("/segments/table-metrics/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("revenue")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values.p1").value(12.5))
                .andExpect(jsonPath("$.values.p2").value(0));
    }

    @Test
    @DisplayName("POST /segments/table-metrics/evaluate - unknown column returns 404")
    void unknownColumnReturns404() throws Exception {
        when(tableMetricService.evaluate("projects", "missing", "project", List.of("p1", "p2")))
                .thenThrow(new NotFoundException("Metric column not found: projects.missing (project)"));

        mockMvc.perform(post("/segments/table-metrics/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload("missing")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Metric column not found: projects.missing (project)"));
    }

    @Test
    @DisplayName("POST /segments/table-metrics/evaluate - missing columnKey returns 400")
    void missingColumnReturns400() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
                "tableId", "projects",
                "entityKind", "project",
                "entityIds", List.of("p1")
        ));

        mockMvc.perform(post("/segments/table-metrics/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("columnKey"));
    }

    @Test
    @DisplayName("GET /segments/table-metrics - lists column definitions")
    void listReturnsColumns() throws Exception {
        when(tableMetricService.list("projects", null)).thenReturn(TableMetricListResponse.builder()
                .tableId("projects")
                .columns(List.of(TableMetricColumn.builder()
                        .segmentKey("revenue_col")
                        .columnKey("revenue")
                        .columnLabel("Revenue")
                        .entityKind("project")
                        .entityIdField("id")
                        .metricKey("revenue")
                        .agg(AggregationFunction.SUM)
                        .window(WindowPreset.LAST_30_DAYS)
                        .decimals(2)
                        .build()))
                .build());

        mockMvc.perform(get("/segments/table-metrics").param("tableId", "projects"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.columns[0].columnKey").value("revenue"))
                .andExpect(jsonPath("$.columns[0].agg").value("sum"))
                .andExpect(jsonPath("$.columns[0].window").value("last_30_days"));
    }

    private String payload(String columnKey) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "tableId", "projects",
                "columnKey", columnKey,
                "entityKind", "project",
                "entityIds", List.of("p1", "p2")
        ));
    }
}
