package com.baykanat.metrics.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** app.* için tip güvenli configuration (ingest chunk boyutu, sorgu limitleri, segment limitleri, Kafka topic adları). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private IngestProperties ingest = new IngestProperties();
    private QueryProperties query = new QueryProperties();
    private SegmentProperties segments = new SegmentProperties();
    private DirectoryProperties directory = new DirectoryProperties();
    private KafkaTopicProperties kafka = new KafkaTopicProperties();

    @Getter
    @Setter
    public static class IngestProperties {
        /** Tek batchUpdate çağrısındaki satır sayısı. */
        private int chunkSize = 500;
    }

    @Getter
    @Setter
    public static class QueryProperties {
        private int maxEntityIds = 1000;
        private int maxBatchQueries = 200;
        /** Batch sorgular için thread pool boyutu. */
        private int batchParallelism = 8;
        private int maxDrilldownPageSize = 500;
        private int contributorLimit = 20;
    }

    @Getter
    @Setter
    public static class SegmentProperties {
        private int maxBucketEntityIds = 500;
        private int maxPageSize = 500;
    }

    @Getter
    @Setter
    public static class DirectoryProperties {
        /** Kullanıcı dizini tablosu (email, role, email_verified, locked). */
        private String usersTable = "auth_users";
    }

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String pointsIngestion = "metric-points-ingestion";
        }
    }
}
