package com.taskpool.config;

/**
 * Configuration for a worker pool.
 *
 * @param name             Pool name identifier, used in log messages
 * @param threadCount      Number of persistent worker threads
 * @param threadNamePrefix Prefix for worker thread names
 * @param daemon           Whether worker threads are daemon threads
 */
public record PoolConfig(
        String name,
        int threadCount,
        String threadNamePrefix,
        boolean daemon
) {
    /**
     * Default configuration: one worker per available processor.
     */
    public static PoolConfig defaults() {
        return withThreads(Runtime.getRuntime().availableProcessors());
    }

    /**
     * Default naming with an explicit thread count.
     */
    public static PoolConfig withThreads(int threadCount) {
        return new PoolConfig("default-pool", threadCount, "pool-worker-", false);
    }

    /**
     * Create a minimal configuration for testing.
     */
    public static PoolConfig minimal() {
        return new PoolConfig("test-pool", 2, "test-worker-", true);
    }
}
