package com.copilot.config;

/**
 * Settings of the worker pool that evaluates subjects.
 *
 * @param parallelism       Number of worker threads
 * @param subjectTimeoutMs  Wait limit per subject in milliseconds (0 = wait indefinitely)
 * @param threadNamePrefix  Worker thread name prefix
 */
public record ExecutionConfig(int parallelism, long subjectTimeoutMs, String threadNamePrefix) {

    public static final String DEFAULT_THREAD_NAME_PREFIX = "decision-worker-";

    public ExecutionConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        if (subjectTimeoutMs < 0) {
            throw new IllegalArgumentException("subject-timeout-ms cannot be negative: " + subjectTimeoutMs);
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
        }
    }

    /**
     * One worker per available processor, no timeout.
     */
    public static ExecutionConfig defaults() {
        return new ExecutionConfig(Runtime.getRuntime().availableProcessors(), 0, DEFAULT_THREAD_NAME_PREFIX);
    }

    public static ExecutionConfig sequential() {
        return new ExecutionConfig(1, 0, DEFAULT_THREAD_NAME_PREFIX);
    }

    public boolean hasTimeout() {
        return subjectTimeoutMs > 0;
    }
}
