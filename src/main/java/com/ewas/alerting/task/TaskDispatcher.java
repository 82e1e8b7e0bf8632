package com.ewas.alerting.task;

import com.ewas.alerting.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Runs tasks on the worker pool when one is available, otherwise on the caller thread.
 *
 * A task that the pool rejects (queue full, shutting down) is run synchronously instead.
 */
@Slf4j
@Component
public class TaskDispatcher {

    private final Executor executor;

    @Autowired
    public TaskDispatcher(@Qualifier(AsyncConfig.WORKER_EXECUTOR) @Nullable ThreadPoolTaskExecutor executor) {
        this((Executor) executor);
    }

    public TaskDispatcher(@Nullable Executor executor) {
        this.executor = executor;
        log.info("[DISPATCHER] Worker pool {}", executor == null ? "absent, tasks run synchronously" : "available");
    }

    public boolean workersAvailable() {
        if (executor == null) {
            return false;
        }
        if (executor instanceof ThreadPoolTaskExecutor pool) {
            try {
                return !pool.getThreadPoolExecutor().isShutdown();
            } catch (IllegalStateException e) {
                log.warn("[DISPATCHER] Worker pool not initialized: {}", e.getMessage());
                return false;
            }
        }
        return true;
    }

    /**
     * @param task receives the generated task id
     */
    public <T> TaskSubmission<T> submit(String taskName, Function<String, T> task) {
        String taskId = UUID.randomUUID().toString();

        if (workersAvailable()) {
            try {
                CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> task.apply(taskId), executor);
                log.debug("[DISPATCHER] {} {} queued on worker pool", taskName, taskId);
                return new TaskSubmission<>(taskId, taskName, ExecutionMode.ASYNC, future);
            } catch (RejectedExecutionException e) {
                log.warn("[DISPATCHER] Worker pool rejected {} {}, running synchronously: {}", taskName, taskId, e.getMessage());
            }
        }

        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            future.complete(task.apply(taskId));
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return new TaskSubmission<>(taskId, taskName, ExecutionMode.SYNC, future);
    }
}
