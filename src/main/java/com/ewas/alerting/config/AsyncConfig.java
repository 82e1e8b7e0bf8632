package com.ewas.alerting.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * AsyncConfig - worker pool for detector runs and publication tasks.
 *
 * The pool is only created when workers are enabled; without it every task
 * runs synchronously on the caller thread.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    public static final String WORKER_EXECUTOR = "alertWorkerExecutor";

    /**
     * Uses AbortPolicy; TaskDispatcher runs rejected tasks synchronously.
     */
    @Bean(name = WORKER_EXECUTOR)
    @ConditionalOnProperty(prefix = "alert-framework.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ThreadPoolTaskExecutor alertWorkerExecutor(AlertFrameworkProperties properties) {
        AlertFrameworkProperties.Worker worker = properties.getWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // Fixed pool size for predictable behavior
        executor.setCorePoolSize(worker.getPoolSize());
        executor.setMaxPoolSize(worker.getPoolSize());
        executor.setQueueCapacity(worker.getQueueCapacity());
        executor.setThreadNamePrefix(worker.getThreadPrefix());

        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);

        // Wait for in-flight runs on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("[WORKER-EXECUTOR] Initialized: poolSize={}, queueCapacity={}, threadPrefix={}",
            worker.getPoolSize(), worker.getQueueCapacity(), worker.getThreadPrefix());
        return executor;
    }
}
