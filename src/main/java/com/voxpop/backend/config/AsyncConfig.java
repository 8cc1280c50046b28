package com.voxpop.backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
@EnableConfigurationProperties({ImportProperties.class, AudienceProperties.class})
public class AsyncConfig {

    /**
     * Executor for import jobs. Jobs queue rather than run on the request thread, and the executor
     * waits for running jobs on shutdown.
     */
    @Bean(name = "importExecutor")
    public Executor importExecutor(ImportProperties importProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(importProperties.workerThreads());
        executor.setMaxPoolSize(importProperties.workerThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("import-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
