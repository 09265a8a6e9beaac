package com.taskpool.core;

/**
 * One queued unit of work bound to the set that owns it.
 * Created at submission and dropped once its action has run.
 */
final class Task implements Runnable {

    private final Runnable action;
    private final TaskSet taskSet;
    private final long taskId;

    Task(Runnable action, TaskSet taskSet, long taskId) {
        this.action = action;
        this.taskSet = taskSet;
        this.taskId = taskId;
    }

    @Override
    public void run() {
        action.run();
    }

    TaskSet getTaskSet() {
        return taskSet;
    }

    long getTaskId() {
        return taskId;
    }

    @Override
    public String toString() {
        return "Task{" +
                "taskId=" + taskId +
                ", set='" + taskSet.getName() + '\'' +
                ", priority=" + taskSet.getPriority() +
                '}';
    }
}
