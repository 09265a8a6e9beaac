package com.taskpool.core;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Counting completion barrier for a group of tasks submitted under one priority tier.
 * <p>
 * A set is complete when every task added to it has finished. Tasks may be added at
 * any time, but callers are expected to finish submitting before they wait.
 * <p>
 * There are two ways to wait:
 * <ul>
 *   <li>{@link #await()} parks the calling thread until the set completes. It
 *       contributes no work, so calling it from inside a task can deadlock a pool
 *       whose workers are all waiting.</li>
 *   <li>{@link #run()} turns the calling thread into a temporary worker that executes
 *       queued tasks of any set until this set completes. Use it from inside tasks.</li>
 * </ul>
 * The set keeps a reference to its pool but does not own it. The pool must stay open
 * until every task of the set has run and every wait on the set has returned; tasks
 * discarded by {@link WorkerPool#shutdown()} leave the set permanently incomplete.
 */
public class TaskSet {

    private final WorkerPool pool;
    private final TaskPriority priority;
    private final String name;

    private final AtomicLong total = new AtomicLong(0);
    private final AtomicLong finished = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private final AtomicReference<Throwable> firstFailure = new AtomicReference<>();

    private final Object monitor = new Object();

    /**
     * Create a set named by the pool's own sequence.
     */
    public TaskSet(WorkerPool pool, TaskPriority priority) {
        this(pool, priority, Objects.requireNonNull(pool, "Pool cannot be null").nextTaskSetName());
    }

    public TaskSet(WorkerPool pool, TaskPriority priority, String name) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.priority = Objects.requireNonNull(priority, "Priority cannot be null");
        this.name = Objects.requireNonNull(name, "Name cannot be null");
    }

    /**
     * Submit an action to the owning pool as part of this set.
     *
     * @throws com.taskpool.exception.TaskRejectedException if the pool is shutting down
     */
    public void enqueue(Runnable action) {
        pool.submit(this, action);
    }

    /**
     * Submit an action that receives {@code argument} when it runs.
     *
     * @throws com.taskpool.exception.TaskRejectedException if the pool is shutting down
     */
    public <A> void enqueue(Consumer<? super A> action, A argument) {
        pool.submit(this, action, argument);
    }

    /**
     * Block until every added task has finished, without executing any work.
     * Returns immediately if the set is already complete.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void await() throws InterruptedException {
        synchronized (monitor) {
            while (!isComplete()) {
                monitor.wait();
            }
        }
    }

    /**
     * Execute queued tasks on the calling thread until this set completes or the pool
     * shuts down. Safe to call from inside a task.
     */
    public void run() {
        pool.run(this);
    }

    /**
     * Count one more task. Called by the pool before the task becomes visible to workers.
     */
    void add() {
        total.incrementAndGet();
    }

    /**
     * Count one finished task and wake plain waiters if that completed the set.
     *
     * @return true if this call completed the set
     */
    boolean finish() {
        long done = finished.incrementAndGet();
        if (done != total.get()) {
            return false;
        }
        synchronized (monitor) {
            monitor.notifyAll();
        }
        return true;
    }

    void recordFailure(Throwable failure) {
        failed.incrementAndGet();
        firstFailure.compareAndSet(null, failure);
    }

    public boolean isComplete() {
        long done = finished.get();
        return done == total.get();
    }

    public WorkerPool getPool() {
        return pool;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public String getName() {
        return name;
    }

    /**
     * Number of tasks ever added to this set.
     */
    public long getTotal() {
        return total.get();
    }

    /**
     * Number of tasks that have run, successfully or not.
     */
    public long getFinished() {
        return finished.get();
    }

    public long getPending() {
        return total.get() - finished.get();
    }

    /**
     * Number of tasks whose action threw.
     */
    public long getFailedCount() {
        return failed.get();
    }

    /**
     * First exception thrown by a task of this set, if any.
     */
    public Optional<Throwable> getFirstFailure() {
        return Optional.ofNullable(firstFailure.get());
    }

    @Override
    public String toString() {
        return "TaskSet{" +
                "name='" + name + '\'' +
                ", priority=" + priority +
                ", finished=" + finished.get() +
                ", total=" + total.get() +
                '}';
    }
}
