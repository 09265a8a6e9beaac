package com.taskpool.exception;

/**
 * Thrown by a partitioned parallel loop when one or more partition actions failed.
 * The first failure is the cause; later ones are attached as suppressed exceptions.
 */
public class PartitionExecutionException extends PoolException {

    private final int partition;

    public PartitionExecutionException(String message, int partition, Throwable cause) {
        super(message, cause);
        this.partition = partition;
    }

    /**
     * Index of the partition whose action failed first, or -1 if the failure
     * happened outside a partition action.
     */
    public int getPartition() {
        return partition;
    }
}
