package com.itrassist.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    public static final String DOCUMENT_EXTRACTION_EXECUTOR = "documentExtractionTaskExecutor";
    public static final String VISION_EXECUTOR = "visionTaskExecutor";

    @Bean(name = DOCUMENT_EXTRACTION_EXECUTOR)
    public Executor documentExtractionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("doc-extract-");
        executor.initialize();
        return executor;
    }

    // Vision calls block on network I/O and get their own pool.
    @Bean(name = VISION_EXECUTOR)
    public ThreadPoolTaskExecutor visionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("vision-");
        executor.initialize();
        return executor;
    }
}
