package com.inboxflow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool that runs claimed flow executions. Sized separately from the
 * Kafka listener containers so flow traversal never starves event processing.
 */
@Configuration
public class FlowWorkerConfig {

    @Bean(name = "flowExecutor")
    public ThreadPoolTaskExecutor flowExecutor(InboxflowProperties properties) {
        int threads = properties.getFlows().getWorkerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        // Poller never claims more than one batch ahead of the workers
        executor.setQueueCapacity(properties.getFlows().getBatchSize() * 2);
        executor.setThreadNamePrefix("flow-exec-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
