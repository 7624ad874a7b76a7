package com.baykanat.metrics.core.infrastructure.kafka;

import com.baykanat.metrics.core.api.dto.MetricPointRequest;
import com.baykanat.metrics.core.domain.mapper.MetricPointMapper;
import com.baykanat.metrics.core.domain.service.PointIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Connector'ların gönderdiği point'leri batch tüketir; HTTP ile aynı ingestion servisinden geçirir.
 * Deserialize edilemeyen kayıtlar DLT'ye; DB hataları DefaultErrorHandler ile retry → DLT.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricPointKafkaConsumer {

    /** ErrorHandlingDeserializer hata durumunda bu header'ı set eder; value null olur. */
    private static final String VALUE_DESERIALIZATION_EXCEPTION_HEADER =
            "springDeserializationValueException";

    private final PointIngestionService ingestionService;
    private final MetricPointMapper pointMapper;
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${app.kafka.topic.points-ingestion}")
    private String pointsIngestionTopic;

    @KafkaListener(
            topics = "${app.kafka.topic.points-ingestion}",
            groupId = "${spring.kafka.consumer.group-id}"
    )
    public void consume(List<ConsumerRecord<String, Object>> records, Acknowledgment acknowledgment) {
        log.debug("Received batch of {} records from points-ingestion topic", records.size());

        List<MetricPointRequest> points = new ArrayList<>(records.size());
        int dltCount = 0;

        for (ConsumerRecord<String, Object> record : records) {
            if (hasDeserializationError(record)) {
                log.error("Kafka deserialization failed for record at offset={}, partition={}",
                        record.offset(), record.partition());
                publishToDlt(record, "Kafka-level deserialization failure");
                dltCount++;
                continue;
            }

            try {
                MetricPointRequest point = pointMapper.fromRecordValue(record.value());
                if (point != null) {
                    points.add(point);
                }
            } catch (IllegalArgumentException e) {
                log.error("Failed to convert record at offset={}, partition={}: {}",
                        record.offset(), record.partition(), e.getMessage());
                publishToDlt(record, e.getMessage());
                dltCount++;
            }
        }

        if (!points.isEmpty()) {
            int ingested = ingestionService.ingestBatch(points);
            log.info("Batch processed: {} records received, {} points converted, {} points ingested, {} sent to DLT",
                    records.size(), points.size(), ingested, dltCount);
        } else if (dltCount > 0) {
            log.warn("All {} records in batch failed deserialization, {} sent to DLT", records.size(), dltCount);
        }

        acknowledgment.acknowledge();
    }

    private boolean hasDeserializationError(ConsumerRecord<String, Object> record) {
        Headers headers = record.headers();
        return headers.lastHeader(VALUE_DESERIALIZATION_EXCEPTION_HEADER) != null;
    }

    /** DLT gönderimi hata verirse sadece log; batch devam eder. */
    private void publishToDlt(ConsumerRecord<String, Object> record, String reason) {
        String topic = Objects.requireNonNull(pointsIngestionTopic, "pointsIngestionTopic") + ".DLT";
        try {
            String key = Objects.requireNonNullElse(record.key(), "");
            kafkaTemplate.send(topic, key, record.value());
            log.warn("Sent failed record to DLT: topic={}, offset={}, partition={}, reason={}",
                    topic, record.offset(), record.partition(), Objects.requireNonNullElse(reason, ""));
        } catch (Exception dltEx) {
            log.error("Failed to publish record to DLT {}: {}", topic, dltEx.getMessage());
        }
    }
}
