package com.ewas.alerting.task;

import java.util.concurrent.CompletableFuture;

/**
 * Descriptor returned for every submitted task. For SYNC submissions the result is already complete.
 */
public record TaskSubmission<T>(String taskId, String taskName, ExecutionMode mode, CompletableFuture<T> result) {

    public T join() {
        return result.join();
    }

    public boolean isAsync() {
        return mode == ExecutionMode.ASYNC;
    }
}
