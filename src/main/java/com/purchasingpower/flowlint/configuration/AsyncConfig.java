package com.purchasingpower.flowlint.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for running analysis passes side by side.
 *
 * Passes only read the loaded graph, so they need no coordination beyond
 * joining their results.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(FlowLintProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(properties.getAnalysisThreads());
        executor.setMaxPoolSize(properties.getAnalysisThreads());

        // One task per pass per run, a small queue is plenty
        executor.setQueueCapacity(50);

        executor.setThreadNamePrefix("analysis-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("Analysis executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
