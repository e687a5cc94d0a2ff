package com.glisk.backend.pipeline.tx;

/**
 * Explicit transaction handle for one decision point of a worker iteration.
 * Exactly one of {@link #commit()} or {@link #rollback()} ends it; {@link #close()} rolls back
 * whatever is still open so try-with-resources never leaks a connection.
 */
public interface WorkerTransaction extends AutoCloseable {

    void commit();

    void rollback();

    boolean isCompleted();

    @Override
    default void close() {
        if (!isCompleted()) rollback();
    }
}
