package com.taskpool.partition;

/**
 * Work performed for one partition index.
 */
@FunctionalInterface
public interface PartitionAction {

    /**
     * @param partition Index of the claimed partition
     * @param threadId  Index of the thread running it, in {@code [0, threadCount)}
     */
    void run(int partition, int threadId);
}
