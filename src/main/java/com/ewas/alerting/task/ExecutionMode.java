package com.ewas.alerting.task;

/**
 * How a submitted task was executed.
 */
public enum ExecutionMode {
    /** On the caller thread, because no worker pool is available or it refused the task. */
    SYNC,
    /** On the worker pool. */
    ASYNC
}
