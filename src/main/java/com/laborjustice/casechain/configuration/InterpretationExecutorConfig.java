package com.laborjustice.casechain.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for per-record movement interpretation.
 *
 * Interpretation is a pure function over disjoint records, so partitions can
 * run on any worker and are merged on the calling thread.
 */
@Slf4j
@Configuration
public class InterpretationExecutorConfig {

    @Bean(name = "interpretationExecutor")
    public ThreadPoolTaskExecutor interpretationExecutor(ReconciliationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int threads = properties.getEngine().getInterpretationThreads();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);

        // Unbounded queue: partitions are few and short-lived
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("interpret-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Interpretation executor configured: threads={}", threads);

        return executor;
    }
}
