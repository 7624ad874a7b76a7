package com.baykanat.metrics.core.infrastructure.kafka;

import com.baykanat.metrics.core.api.dto.MetricPointRequest;
import com.baykanat.metrics.core.domain.mapper.MetricPointMapper;
import com.baykanat.metrics.core.domain.service.PointIngestionService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MetricPointKafkaConsumer: records go through the same ingestion path as HTTP,
 * undeserializable records are routed to the dead letter topic and the batch is always acknowledged.
 */
@ExtendWith(MockitoExtension.class)
class MetricPointKafkaConsumerTest {

    private static final String TOPIC = "metric-points-ingestion";

    @Mock
    private PointIngestionService ingestionService;

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @Mock
    private Acknowledgment acknowledgment;

    private MetricPointKafkaConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new MetricPointKafkaConsumer(ingestionService, Mappers.getMapper(MetricPointMapper.class),
                kafkaTemplate);
        ReflectionTestUtils.setField(consumer, "pointsIngestionTopic", TOPIC);
    }

    @Test
    @DisplayName("Typed and map values are ingested as one batch")
    void ingestsBatch() {
        MetricPointRequest typed = MetricPointRequest.builder()
                .entityKind("project").entityId("p1").metricKey("revenue")
                .dataSourceId("ds_1").date("2024-01-01").value("10").build();
        Map<String, Object> untyped = Map.of(
                "entityKind", "project", "entityId", "p2", "metricKey", "revenue",
                "dataSourceId", "ds_1", "date", "2024-01-01", "value", 7);

        consumer.consume(List.of(record(0, typed), record(1, untyped)), acknowledgment);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MetricPointRequest>> captor = ArgumentCaptor.forClass(List.class);
        verify(ingestionService).ingestBatch(captor.capture());
        assertThat(captor.getValue()).extracting(MetricPointRequest::getEntityId).containsExactly("p1", "p2");
        assertThat(captor.getValue().get(1).getValue()).isEqualTo("7");
        verify(acknowledgment).acknowledge();
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("Record with a deserialization error header goes to the DLT and the batch is acknowledged")
    void deserializationFailureGoesToDlt() {
        ConsumerRecord<String, Object> broken = record(3, null);
        broken.headers().add("springDeserializationValueException", "boom".getBytes(StandardCharsets.UTF_8));

        consumer.consume(List.of(broken), acknowledgment);

        verify(kafkaTemplate).send(eq(TOPIC + ".DLT"), eq("key-3"), any());
        verify(ingestionService, never()).ingestBatch(anyList());
        verify(acknowledgment).acknowledge();
    }

    @Test
    @DisplayName("DLT publish failure does not stop the rest of the batch")
    void dltFailureIsLogged() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("broker down"));
        ConsumerRecord<String, Object> broken = record(0, null);
        broken.headers().add("springDeserializationValueException", new byte[0]);
        MetricPointRequest good = MetricPointRequest.builder()
                .entityKind("project").entityId("p1").metricKey("revenue")
                .dataSourceId("ds_1").date("2024-01-01").value("1").build();

        consumer.consume(List.of(broken, record(1, good)), acknowledgment);

        verify(ingestionService).ingestBatch(List.of(good));
        verify(acknowledgment).acknowledge();
    }

    private static ConsumerRecord<String, Object> record(long offset, Object value) {
        return new ConsumerRecord<>(TOPIC, 0, offset, "key-" + offset, value);
    }
}
