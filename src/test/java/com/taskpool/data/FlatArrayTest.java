package com.taskpool.data;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FlatArray.
 */
class FlatArrayTest {

    private FlatArray<String> array;

    @BeforeEach
    void setUp() {
        array = new FlatArray<>();
    }

    @Test
    @DisplayName("Should start with no groups")
    void shouldStartEmpty() {
        assertEquals(0, array.size());
        assertEquals(0, array.dataSize());
        assertThrows(IndexOutOfBoundsException.class, () -> array.group(0));
    }

    @Test
    @DisplayName("Should append elements to the last opened group")
    void shouldAppendToLastGroup() {
        array.next();
        array.add("a");
        array.add("b");
        array.next();
        array.next();
        array.add("c");

        assertEquals(3, array.size());
        assertEquals(3, array.dataSize());
        assertEquals(List.of("a", "b"), array.group(0));
        assertEquals(0, array.count(1));
        assertEquals(List.of("c"), array.group(2));
    }

    @Test
    @DisplayName("Should append complete groups")
    void shouldAppendGroups() {
        array.addGroup(List.of("x", "y"));
        array.addGroup(List.of());
        array.addGroup(List.of("z"));

        assertEquals(3, array.size());
        assertEquals(2, array.count(0));
        assertEquals(0, array.count(1));
        assertEquals(List.of("z"), array.group(2));
    }

    @Test
    @DisplayName("Should remove the last group with its elements")
    void shouldPopBack() {
        array.addGroup(List.of("a"));
        array.addGroup(List.of("b", "c"));

        array.popBack();

        assertEquals(1, array.size());
        assertEquals(1, array.dataSize());
        array.next();
        array.add("d");
        assertEquals(List.of("d"), array.group(1));
    }

    @Test
    @DisplayName("Should reject add before any group and pop on empty")
    void shouldRejectInvalidState() {
        assertThrows(IllegalStateException.class, () -> array.add("a"));
        assertThrows(IllegalStateException.class, () -> array.popBack());
    }

    @Test
    @DisplayName("Should clear all groups")
    void shouldClear() {
        array.reserve(4, 16);
        array.addGroup(List.of("a", "b"));
        array.clear();

        assertEquals(0, array.size());
        assertEquals(0, array.dataSize());
    }

    @Test
    @DisplayName("Should expose read-only group views")
    void shouldExposeReadOnlyViews() {
        array.addGroup(List.of("a"));
        assertThrows(UnsupportedOperationException.class, () -> array.group(0).add("b"));
    }
}
