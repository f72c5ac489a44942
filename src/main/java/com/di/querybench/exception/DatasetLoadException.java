package com.di.querybench.exception;

/**
 * A store write failed while loading the dataset. The surrounding reload transaction is
 * rolled back; the dataset must be reloaded from scratch.
 */
public class DatasetLoadException extends RuntimeException {

    private final String entityLabel;
    private final long   batchNumber;

    public DatasetLoadException(String entityLabel, long batchNumber, Throwable cause) {
        super("Batch " + batchNumber + " of " + entityLabel + " failed: "
                + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
        this.entityLabel = entityLabel;
        this.batchNumber = batchNumber;
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
        this.entityLabel = null;
        this.batchNumber = -1;
    }

    public String getEntityLabel() {
        return entityLabel;
    }

    /** One-based batch number, or -1 when the failure was outside a batch. */
    public long getBatchNumber() {
        return batchNumber;
    }
}
