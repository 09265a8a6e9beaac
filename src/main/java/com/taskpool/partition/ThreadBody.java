package com.taskpool.partition;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Body of one thread in {@link PartitionedExecution#run(int, ThreadBody)}.
 * All threads of a run receive the same counter.
 */
@FunctionalInterface
public interface ThreadBody {

    void run(AtomicInteger counter, int threadId);
}
