package com.taskpool.partition;

import com.taskpool.exception.PartitionExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot parallel loop over a fixed number of partitions.
 * <p>
 * Each call spawns its own threads, lets them claim partition indices from a single
 * shared counter and joins them before returning. No queue, no priorities and no
 * persistent threads; use {@link com.taskpool.core.WorkerPool} for nested work.
 */
public final class PartitionedExecution {

    private static final Logger log = LoggerFactory.getLogger(PartitionedExecution.class);

    private static final String THREAD_NAME_PREFIX = "partition-worker-";

    private PartitionedExecution() {
    }

    /**
     * Run {@code action} once for every index in {@code [0, partitionCount)} on
     * {@code threadCount} threads.
     *
     * @throws PartitionExecutionException if any partition action threw, including an {@link Error}
     * @throws InterruptedException        if interrupted while joining the threads; thrown
     *                                     only after every thread has finished
     */
    public static void forEachPartition(int threadCount, int partitionCount, PartitionAction action)
            throws InterruptedException {
        if (partitionCount < 0) {
            throw new IllegalArgumentException("Partition count cannot be negative: " + partitionCount);
        }
        if (action == null) {
            throw new NullPointerException("Action cannot be null");
        }
        run(threadCount, (counter, threadId) -> {
            int partition;
            while ((partition = counter.getAndIncrement()) < partitionCount) {
                try {
                    action.run(partition, threadId);
                } catch (RuntimeException | Error e) {
                    throw new PartitionExecutionException(
                            "Partition " + partition + " failed on thread " + threadId, partition, e);
                }
            }
        });
    }

    /**
     * Start {@code threadCount} threads that each run {@code body} with a shared
     * counter starting at zero, and join them all.
     *
     * @throws PartitionExecutionException if any thread body threw
     * @throws InterruptedException        if interrupted while joining the threads; thrown
     *                                     only after every thread has finished
     */
    public static void run(int threadCount, ThreadBody body) throws InterruptedException {
        if (threadCount <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threadCount);
        }
        if (body == null) {
            throw new NullPointerException("Body cannot be null");
        }

        AtomicInteger counter = new AtomicInteger(0);
        AtomicReference<PartitionExecutionException> failure = new AtomicReference<>();
        List<Thread> threads = new ArrayList<>(threadCount);

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            Thread thread = new Thread(() -> {
                try {
                    body.run(counter, threadId);
                } catch (RuntimeException | Error e) {
                    PartitionExecutionException wrapped = e instanceof PartitionExecutionException pe
                            ? pe
                            : new PartitionExecutionException("Thread " + threadId + " failed", -1, e);
                    if (!failure.compareAndSet(null, wrapped)) {
                        failure.get().addSuppressed(wrapped);
                    }
                    log.debug("Partition thread {} failed: {}", threadId, e.getMessage());
                }
            }, THREAD_NAME_PREFIX + threadId);
            threads.add(thread);
            thread.start();
        }

        // Every thread is joined even if the caller is interrupted, so no spawned
        // thread outlives this call.
        InterruptedException interrupted = null;
        for (Thread thread : threads) {
            while (true) {
                try {
                    thread.join();
                    break;
                } catch (InterruptedException e) {
                    if (interrupted == null) {
                        interrupted = e;
                    }
                }
            }
        }
        if (interrupted != null) {
            log.warn("Interrupted while joining {} partition threads", threadCount);
            throw interrupted;
        }

        log.debug("Partitioned run finished on {} threads", threadCount);

        PartitionExecutionException first = failure.get();
        if (first != null) {
            throw first;
        }
    }
}
