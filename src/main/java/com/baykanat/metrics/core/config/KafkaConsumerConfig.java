package com.baykanat.metrics.core.config;

import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/** Point ingestion consumer hata işleme: exponential backoff retry, ardından DLT'ye gönderim. */
@Configuration
public class KafkaConsumerConfig {

    @Value("${app.kafka.topic.points-ingestion}")
    private String pointsIngestionTopic;

    @Bean
    public CommonErrorHandler kafkaErrorHandler(KafkaOperations<?, ?> kafkaOperations) {
        // DLT tek partition; -1 ile partition seçimi producer'a bırakılır
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaOperations,
                (record, ex) -> new TopicPartition(pointsIngestionTopic + ".DLT", -1)
        );

        // Toplam 8 sn retry, sonra DLT
        ExponentialBackOff backOff = new ExponentialBackOff(1000L, 2.0);
        backOff.setMaxInterval(4000L);
        backOff.setMaxElapsedTime(8000L);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        // Bilinmeyen dataSourceId gibi FK ihlalleri tekrar denemekle düzelmez
        errorHandler.addNotRetryableExceptions(DataIntegrityViolationException.class);
        return errorHandler;
    }
}
