package com.taskpool.core;

/**
 * Priority tier of a {@link TaskSet}.
 * <p>
 * Declaration order is dispatch order: a pending HIGH task is always taken before
 * any pending LOW task. No aging is applied.
 */
public enum TaskPriority {
    HIGH,
    LOW
}
