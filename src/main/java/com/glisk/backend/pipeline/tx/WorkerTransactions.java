package com.glisk.backend.pipeline.tx;

/** Opens {@link WorkerTransaction}s. Workers depend on this, tests swap in an in-memory one. */
public interface WorkerTransactions {

    WorkerTransaction begin();
}
