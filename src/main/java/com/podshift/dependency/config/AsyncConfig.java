package com.podshift.dependency.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool the resolver runs relationship extractors on.
 * Extraction is a pure in-memory computation, so a small bounded pool is enough.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${podshift.resolver.extractor-pool-size:5}")
    private int poolSize;

    @Bean(name = "extractorExecutor")
    public ThreadPoolTaskExecutor extractorExecutor() {
        log.info("[Async Config] Initializing extractor executor with {} threads", poolSize);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("extractor-");
        // a saturated pool runs the extractor on the requesting thread instead of rejecting it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
