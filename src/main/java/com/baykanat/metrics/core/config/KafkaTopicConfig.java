package com.baykanat.metrics.core.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.util.Objects;

/** Point ingestion ve DLT topic bean'leri. */
@Configuration
public class KafkaTopicConfig {

    @Value("${app.kafka.topic.points-ingestion}")
    private String pointsIngestionTopic;

    /** Connector'ların toplu point gönderdiği topic; partition key dataSourceId. */
    @Bean
    public NewTopic pointsIngestionTopic() {
        return TopicBuilder.name(Objects.requireNonNull(pointsIngestionTopic, "pointsIngestionTopic"))
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic pointsIngestionDlt() {
        return TopicBuilder.name(Objects.requireNonNull(pointsIngestionTopic, "pointsIngestionTopic") + ".DLT")
                .partitions(1)
                .replicas(1)
                .build();
    }
}
