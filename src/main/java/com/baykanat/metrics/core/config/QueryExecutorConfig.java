package com.baykanat.metrics.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/** Batch sorgu thread pool'u ve zaman pencereleri için paylaşılan Clock. */
@Configuration
public class QueryExecutorConfig {

    /** Batch sorgular birbirinden bağımsız; pool boyutu DB bağlantı havuzunu aşmamalı. */
    @Bean(name = "queryExecutor")
    public ThreadPoolTaskExecutor queryExecutor(AppProperties appProperties) {
        int parallelism = appProperties.getQuery().getBatchParallelism();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(appProperties.getQuery().getMaxBatchQueries() * 4);
        executor.setThreadNamePrefix("query-batch-");
        // Kuyruk dolunca slot çağıran thread'de çalışır
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
