package com.taskpool.core;

import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Fixed-size pool of worker threads fed by one FIFO queue per priority tier.
 * <p>
 * Work is submitted against a {@link TaskSet}; callers wait on the set rather than
 * on individual tasks. Pools are independent objects: any number may coexist.
 */
public interface WorkerPool extends AutoCloseable {

    /**
     * Create a new task set bound to this pool.
     */
    default TaskSet createTaskSet(TaskPriority priority) {
        return new TaskSet(this, priority);
    }

    /**
     * Create a new named task set bound to this pool.
     */
    default TaskSet createTaskSet(TaskPriority priority, String name) {
        return new TaskSet(this, priority, name);
    }

    /**
     * Next default task set name from this pool's sequence. Each pool numbers its
     * sets independently.
     */
    String nextTaskSetName();

    /**
     * Queue an action as part of a task set, on the set's priority tier.
     *
     * @param taskSet Set the task belongs to; must have been created for this pool
     * @param action  The action to execute
     * @throws com.taskpool.exception.TaskRejectedException if the pool is shutting down
     */
    void submit(TaskSet taskSet, Runnable action);

    /**
     * Queue an action that receives {@code argument} when it runs.
     *
     * @throws com.taskpool.exception.TaskRejectedException if the pool is shutting down
     */
    <A> void submit(TaskSet taskSet, Consumer<? super A> action, A argument);

    /**
     * Block until the set completes, without executing any work.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void await(TaskSet taskSet) throws InterruptedException;

    /**
     * Execute queued work on the calling thread until the set completes or the pool
     * begins shutdown. Safe to call from inside a running task.
     */
    void run(TaskSet taskSet);

    /**
     * Stop accepting work, discard everything still queued and join every worker.
     * Tasks already running are allowed to finish.
     */
    void shutdown();

    /**
     * Same as {@link #shutdown()}.
     */
    @Override
    default void close() {
        shutdown();
    }

    /**
     * Wait for termination after shutdown.
     *
     * @param timeout Maximum time to wait
     * @param unit    Time unit
     * @return true if terminated, false if timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    boolean isShutdown();

    /**
     * Check if the pool has been shut down and every worker has exited.
     */
    boolean isTerminated();

    /**
     * Number of queued tasks across both tiers.
     */
    int getQueueSize();

    /**
     * Number of queued tasks on one tier.
     */
    int getQueueSize(TaskPriority priority);

    /**
     * Number of tasks currently executing, on workers or on threads inside {@link #run(TaskSet)}.
     */
    int getActiveCount();

    /**
     * Number of persistent worker threads the pool was created with.
     */
    int getThreadCount();
}
