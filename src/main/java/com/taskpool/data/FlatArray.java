package com.taskpool.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * List of groups stored as one flat data list plus group boundaries.
 * <p>
 * Group {@code i} spans {@code data[limits[i], limits[i + 1])}. {@link #add(Object)}
 * appends to the last group; {@link #next()} opens a new, empty one. Typically one
 * task fills one instance and the caller reads it after the task's set completes.
 * <p>
 * Not thread-safe.
 *
 * @param <T> Element type
 */
public class FlatArray<T> {

    private final ArrayList<T> data = new ArrayList<>();
    private final ArrayList<Integer> limits = new ArrayList<>();

    public FlatArray() {
        limits.add(0);
    }

    /**
     * Append an element to the last group.
     *
     * @throws IllegalStateException if no group has been opened yet
     */
    public void add(T element) {
        if (limits.size() <= 1) {
            throw new IllegalStateException("No open group, call next() first");
        }
        data.add(element);
        int last = limits.size() - 1;
        limits.set(last, limits.get(last) + 1);
    }

    /**
     * Append a complete group.
     */
    public void addGroup(Collection<? extends T> elements) {
        data.addAll(elements);
        limits.add(limits.get(limits.size() - 1) + elements.size());
    }

    /**
     * Open a new empty group after the current last boundary.
     */
    public void next() {
        limits.add(limits.get(limits.size() - 1));
    }

    /**
     * Remove the last group together with its elements.
     */
    public void popBack() {
        if (limits.size() <= 1) {
            throw new IllegalStateException("No group to remove");
        }
        limits.remove(limits.size() - 1);
        int end = limits.get(limits.size() - 1);
        data.subList(end, data.size()).clear();
    }

    public void clear() {
        data.clear();
        limits.clear();
        limits.add(0);
    }

    /**
     * Number of groups.
     */
    public int size() {
        return limits.size() - 1;
    }

    /**
     * Number of elements across all groups.
     */
    public int dataSize() {
        return data.size();
    }

    /**
     * Number of elements in group {@code i}.
     */
    public int count(int i) {
        checkGroup(i);
        return limits.get(i + 1) - limits.get(i);
    }

    /**
     * Read-only view of group {@code i}.
     */
    public List<T> group(int i) {
        checkGroup(i);
        return Collections.unmodifiableList(data.subList(limits.get(i), limits.get(i + 1)));
    }

    /**
     * Capacity hint.
     */
    public void reserve(int groups, int dataSize) {
        data.ensureCapacity(dataSize);
        limits.ensureCapacity(groups + 1);
    }

    private void checkGroup(int i) {
        if (i < 0 || i >= size()) {
            throw new IndexOutOfBoundsException("Group " + i + " out of range [0, " + size() + ")");
        }
    }

    @Override
    public String toString() {
        return "FlatArray{" +
                "groups=" + size() +
                ", dataSize=" + data.size() +
                '}';
    }
}
