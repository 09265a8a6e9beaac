package com.taskpool.partition;

import com.taskpool.exception.PartitionExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PartitionedExecution.
 */
class PartitionedExecutionTest {

    @ParameterizedTest(name = "{0} threads, {1} partitions")
    @CsvSource({
            "1, 10",
            "4, 100",
            "8, 3",
            "3, 0"
    })
    @DisplayName("Should run every partition exactly once")
    void shouldRunEveryPartitionOnce(int threads, int partitions) throws InterruptedException {
        AtomicIntegerArray hits = new AtomicIntegerArray(Math.max(partitions, 1));
        Set<Integer> threadIds = ConcurrentHashMap.newKeySet();

        PartitionedExecution.forEachPartition(threads, partitions, (partition, threadId) -> {
            hits.incrementAndGet(partition);
            threadIds.add(threadId);
        });

        for (int i = 0; i < partitions; i++) {
            assertEquals(1, hits.get(i), "Partition " + i);
        }
        for (int id : threadIds) {
            assertTrue(id >= 0 && id < threads, "Thread id out of range: " + id);
        }
    }

    @Test
    @DisplayName("Should give every thread the same counter")
    void shouldShareCounterAcrossThreads() throws InterruptedException {
        AtomicInteger claimed = new AtomicInteger(0);
        Set<AtomicInteger> counters = ConcurrentHashMap.newKeySet();

        PartitionedExecution.run(4, (counter, threadId) -> {
            counters.add(counter);
            while (counter.getAndIncrement() < 50) {
                claimed.incrementAndGet();
            }
        });

        assertEquals(1, counters.size());
        assertEquals(50, claimed.get());
    }

    @Test
    @DisplayName("Should report the failing partition after joining all threads")
    void shouldReportFailingPartition() {
        AtomicInteger completed = new AtomicInteger(0);

        PartitionExecutionException e = assertThrows(PartitionExecutionException.class, () ->
                PartitionedExecution.forEachPartition(2, 20, (partition, threadId) -> {
                    if (partition == 7) {
                        throw new IllegalStateException("bad partition");
                    }
                    completed.incrementAndGet();
                }));

        assertEquals(7, e.getPartition());
        assertEquals("bad partition", e.getCause().getMessage());
        // The other thread keeps claiming partitions after the failure
        assertTrue(completed.get() >= 1);
        assertTrue(completed.get() <= 19);
    }

    @Test
    @DisplayName("Should rethrow an Error thrown by a partition action")
    void shouldRethrowErrorFromPartition() {
        AtomicInteger completed = new AtomicInteger(0);

        PartitionExecutionException e = assertThrows(PartitionExecutionException.class, () ->
                PartitionedExecution.forEachPartition(2, 10, (partition, threadId) -> {
                    if (partition == 3) {
                        throw new AssertionError("partition 3 broken");
                    }
                    completed.incrementAndGet();
                }));

        assertEquals(3, e.getPartition());
        assertInstanceOf(AssertionError.class, e.getCause());
        assertTrue(completed.get() <= 9);
    }

    @Test
    @DisplayName("Should rethrow an Error thrown by a raw thread body")
    void shouldRethrowErrorFromRawBody() {
        PartitionExecutionException e = assertThrows(PartitionExecutionException.class, () ->
                PartitionedExecution.run(2, (counter, threadId) -> {
                    if (threadId == 1) {
                        throw new StackOverflowError();
                    }
                }));

        assertEquals(-1, e.getPartition());
        assertInstanceOf(StackOverflowError.class, e.getCause());
    }

    @Test
    @DisplayName("Should join every thread before propagating an interrupt")
    void shouldJoinAllThreadsBeforePropagatingInterrupt() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger(0);
        AtomicInteger finishedWhenThrown = new AtomicInteger(-1);
        AtomicReference<Throwable> thrown = new AtomicReference<>();

        Thread caller = new Thread(() -> {
            try {
                PartitionedExecution.run(2, (counter, threadId) -> {
                    started.countDown();
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    finished.incrementAndGet();
                });
            } catch (Throwable t) {
                finishedWhenThrown.set(finished.get());
                thrown.set(t);
            }
        }, "partition-caller");
        caller.start();

        assertTrue(started.await(5, TimeUnit.SECONDS));
        caller.interrupt();
        release.countDown();
        caller.join(5000);

        assertFalse(caller.isAlive());
        assertInstanceOf(InterruptedException.class, thrown.get());
        assertEquals(2, finishedWhenThrown.get());
    }

    @Test
    @DisplayName("Should wrap failures thrown by a raw thread body")
    void shouldWrapRawBodyFailure() {
        PartitionExecutionException e = assertThrows(PartitionExecutionException.class, () ->
                PartitionedExecution.run(1, (counter, threadId) -> {
                    throw new IllegalArgumentException("raw");
                }));

        assertEquals(-1, e.getPartition());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    @DisplayName("Should reject invalid arguments")
    void shouldRejectInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> PartitionedExecution.forEachPartition(0, 5, (p, t) -> {}));
        assertThrows(IllegalArgumentException.class,
                () -> PartitionedExecution.forEachPartition(2, -1, (p, t) -> {}));
        assertThrows(NullPointerException.class,
                () -> PartitionedExecution.forEachPartition(2, 5, null));
        assertThrows(NullPointerException.class,
                () -> PartitionedExecution.run(2, null));
    }
}
