package com.ryuqq.statecheck.adapter.runner;

/**
 * Worker pool explorer configuration (immutable record).
 *
 * @param workers number of threads draining the shared frontier (default 4)
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public record WorkerPoolConfig(int workers) {

    /**
     * Default settings: 4 workers.
     */
    public WorkerPoolConfig() {
        this(4);
    }

    /**
     * @throws IllegalArgumentException if workers is not positive
     */
    public WorkerPoolConfig {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive (current: " + workers + ")");
        }
    }

    public WorkerPoolConfig withWorkers(int workers) {
        return new WorkerPoolConfig(workers);
    }
}
