package com.taskpool.core;

import com.taskpool.config.PoolConfig;
import com.taskpool.exception.TaskRejectedException;
import com.taskpool.scheduler.TieredTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Default implementation of WorkerPool.
 * <p>
 * One lock guards both tier queues and the shutdown flag. Every thread that is
 * waiting for work, whether a persistent worker or a caller inside
 * {@link #run(TaskSet)}, parks on the same condition, so any of them can pick up a
 * newly submitted task. A thread waiting in {@code run} is always a candidate
 * executor for queued work.
 * <p>
 * Dispatch is strict priority. A sustained stream of HIGH submissions starves LOW
 * work; this is accepted.
 * <p>
 * A {@link RuntimeException} thrown by a task is logged, recorded on the task's set
 * and counted as failed; the set still advances so waiters never hang. An
 * {@link Error} is not caught: the set still advances, then the error ends the
 * thread that ran the task.
 */
public class DefaultWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkerPool.class);

    private final PoolConfig config;
    private final TieredTaskQueue<Task> queue = new TieredTaskQueue<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    private final List<WorkerThread> workers;

    private volatile boolean shutdown = false;

    private final AtomicLong setIds = new AtomicLong(0);
    private final AtomicLong taskIds = new AtomicLong(0);
    private final AtomicLong submittedCount = new AtomicLong(0);
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong discardedCount = new AtomicLong(0);
    private final AtomicInteger activeCount = new AtomicInteger(0);

    public DefaultWorkerPool(int threadCount) {
        this(PoolConfig.withThreads(threadCount));
    }

    public DefaultWorkerPool(PoolConfig config) {
        if (config == null) {
            throw new NullPointerException("Config cannot be null");
        }
        if (config.threadCount() <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + config.threadCount());
        }
        this.config = config;

        List<WorkerThread> created = new ArrayList<>(config.threadCount());
        for (int i = 0; i < config.threadCount(); i++) {
            int workerId = i + 1;
            created.add(new WorkerThread(
                    workerId,
                    config.threadNamePrefix() + workerId,
                    config.daemon(),
                    this,
                    log
            ));
        }
        this.workers = Collections.unmodifiableList(created);
        for (WorkerThread worker : workers) {
            worker.start();
        }

        log.info("WorkerPool initialized: {} with {} threads", config.name(), config.threadCount());
    }

    @Override
    public String nextTaskSetName() {
        return config.name() + "-set-" + setIds.incrementAndGet();
    }

    @Override
    public void submit(TaskSet taskSet, Runnable action) {
        if (taskSet == null) {
            throw new NullPointerException("Task set cannot be null");
        }
        if (action == null) {
            throw new NullPointerException("Action cannot be null");
        }
        checkOwnership(taskSet);

        Task task = new Task(action, taskSet, taskIds.incrementAndGet());
        lock.lock();
        try {
            if (shutdown) {
                throw new TaskRejectedException("Pool '" + config.name() + "' is shutdown, task rejected for set '"
                        + taskSet.getName() + "'");
            }
            taskSet.add();
            queue.offer(taskSet.getPriority(), task);
            workAvailable.signal();
        } finally {
            lock.unlock();
        }

        submittedCount.incrementAndGet();
        log.trace("Task {} submitted to set '{}' ({})", task.getTaskId(), taskSet.getName(), taskSet.getPriority());
    }

    @Override
    public <A> void submit(TaskSet taskSet, Consumer<? super A> action, A argument) {
        if (action == null) {
            throw new NullPointerException("Action cannot be null");
        }
        submit(taskSet, () -> action.accept(argument));
    }

    @Override
    public void await(TaskSet taskSet) throws InterruptedException {
        if (taskSet == null) {
            throw new NullPointerException("Task set cannot be null");
        }
        checkOwnership(taskSet);
        taskSet.await();
    }

    @Override
    public void run(TaskSet taskSet) {
        if (taskSet == null) {
            throw new NullPointerException("Task set cannot be null");
        }
        checkOwnership(taskSet);
        if (taskSet.isComplete()) {
            return;
        }
        log.trace("Thread {} draining work until set '{}' completes",
                Thread.currentThread().getName(), taskSet.getName());
        dispatch(taskSet);
    }

    /**
     * Claim and execute queued tasks until the pool shuts down or, when
     * {@code boundSet} is given, until that set completes.
     */
    void dispatch(TaskSet boundSet) {
        while (true) {
            Task task;
            lock.lock();
            try {
                while (!shutdown && queue.isEmpty() && !isComplete(boundSet)) {
                    workAvailable.awaitUninterruptibly();
                }
                if (shutdown && queue.isEmpty()) {
                    return;
                }
                if (isComplete(boundSet)) {
                    // hand a possibly consumed submit signal on to another thread
                    if (!queue.isEmpty()) {
                        workAvailable.signal();
                    }
                    return;
                }
                Optional<Task> next = queue.poll();
                if (next.isEmpty()) {
                    continue;
                }
                task = next.get();
            } finally {
                lock.unlock();
            }
            execute(task);
        }
    }

    private static boolean isComplete(TaskSet boundSet) {
        return boundSet != null && boundSet.isComplete();
    }

    private void execute(Task task) {
        TaskSet taskSet = task.getTaskSet();
        activeCount.incrementAndGet();
        try {
            log.trace("Executing task {} of set '{}'", task.getTaskId(), taskSet.getName());
            task.run();
            completedCount.incrementAndGet();
        } catch (RuntimeException e) {
            failedCount.incrementAndGet();
            taskSet.recordFailure(e);
            log.error("Task {} of set '{}' failed: {}", task.getTaskId(), taskSet.getName(), e.getMessage(), e);
        } finally {
            activeCount.decrementAndGet();
            if (taskSet.finish()) {
                signalCompletion(taskSet);
            }
        }
    }

    /**
     * Wake every thread parked in the dispatch loop so loops bound to the
     * completed set can exit.
     */
    private void signalCompletion(TaskSet taskSet) {
        lock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        log.trace("Set '{}' complete ({} tasks)", taskSet.getName(), taskSet.getTotal());
    }

    private void checkOwnership(TaskSet taskSet) {
        if (taskSet.getPool() != this) {
            throw new IllegalArgumentException("Task set '" + taskSet.getName() + "' belongs to another pool");
        }
    }

    @Override
    public void shutdown() {
        List<Task> discarded;
        boolean first;
        lock.lock();
        try {
            first = !shutdown;
            shutdown = true;
            discarded = queue.drain();
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        if (first) {
            log.info("Shutting down WorkerPool: {}", config.name());
        }
        if (!discarded.isEmpty()) {
            discardedCount.addAndGet(discarded.size());
            log.warn("WorkerPool {} discarded {} queued tasks; their sets will not complete",
                    config.name(), discarded.size());
        }

        Thread current = Thread.currentThread();
        for (WorkerThread worker : workers) {
            if (worker == current) {
                continue;
            }
            try {
                worker.join();
            } catch (InterruptedException e) {
                log.warn("Interrupted while joining worker {} of pool {}", worker.getWorkerId(), config.name());
                Thread.currentThread().interrupt();
                return;
            }
        }
        if (first) {
            log.info("WorkerPool {} terminated", config.name());
        }
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        if (!shutdown) {
            return false;
        }
        long deadline = System.nanoTime() + unit.toNanos(timeout);

        for (WorkerThread worker : workers) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return isTerminated();
            }
            worker.join(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remaining)));
            if (worker.isAlive()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public boolean isTerminated() {
        if (!shutdown) {
            return false;
        }
        for (WorkerThread worker : workers) {
            if (worker.isAlive()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int getQueueSize() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getQueueSize(TaskPriority priority) {
        lock.lock();
        try {
            return queue.size(priority);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getActiveCount() {
        return activeCount.get();
    }

    @Override
    public int getThreadCount() {
        return workers.size();
    }

    /**
     * Number of worker threads still alive. Drops below {@link #getThreadCount()}
     * when a task's {@link Error} has ended a worker.
     */
    public int getLiveThreadCount() {
        int alive = 0;
        for (WorkerThread worker : workers) {
            if (worker.isAlive()) {
                alive++;
            }
        }
        return alive;
    }

    public PoolConfig getConfig() {
        return config;
    }

    /**
     * Get statistics about the pool.
     */
    public PoolStats getStats() {
        return new PoolStats(
                submittedCount.get(),
                completedCount.get(),
                failedCount.get(),
                discardedCount.get(),
                getQueueSize(),
                activeCount.get(),
                workers.size()
        );
    }

    /**
     * Pool statistics.
     */
    public record PoolStats(
            long submittedCount,
            long completedCount,
            long failedCount,
            long discardedCount,
            int queueSize,
            int activeTasks,
            int threadCount
    ) {}
}
