package com.taskpool.scheduler;

import com.taskpool.core.TaskPriority;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One FIFO queue per priority tier.
 * <p>
 * Polling is strict priority: the front of the highest non-empty tier is always
 * returned first. There is no aging, so a steady stream of HIGH items can starve
 * LOW items indefinitely.
 * <p>
 * Not thread-safe. The owning pool guards every call with its own lock.
 *
 * @param <T> Payload type
 */
public final class TieredTaskQueue<T> {

    private final Map<TaskPriority, ArrayDeque<T>> queues = new EnumMap<>(TaskPriority.class);

    public TieredTaskQueue() {
        for (TaskPriority priority : TaskPriority.values()) {
            queues.put(priority, new ArrayDeque<>());
        }
    }

    /**
     * Append an item to the back of its tier.
     */
    public void offer(TaskPriority priority, T item) {
        if (priority == null) {
            throw new NullPointerException("Priority cannot be null");
        }
        if (item == null) {
            throw new NullPointerException("Item cannot be null");
        }
        queues.get(priority).addLast(item);
    }

    /**
     * Remove the front item of the highest non-empty tier.
     */
    public Optional<T> poll() {
        // EnumMap iterates in declaration order, HIGH first
        for (ArrayDeque<T> queue : queues.values()) {
            T item = queue.pollFirst();
            if (item != null) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        for (ArrayDeque<T> queue : queues.values()) {
            if (!queue.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Total size across all tiers.
     */
    public int size() {
        return queues.values().stream().mapToInt(ArrayDeque::size).sum();
    }

    /**
     * Size of a single tier.
     */
    public int size(TaskPriority priority) {
        return queues.get(priority).size();
    }

    /**
     * Remove and return everything still queued, highest tier first.
     */
    public List<T> drain() {
        List<T> drained = new ArrayList<>(size());
        for (ArrayDeque<T> queue : queues.values()) {
            drained.addAll(queue);
            queue.clear();
        }
        return drained;
    }
}
