package com.glisk.backend.pipeline.supervisor;

import java.time.Duration;

/**
 * One pipeline stage as the supervisor sees it: an iteration plus the pause between iterations.
 */
public interface PipelineWorker {

    String name();

    Duration pollInterval();

    /** Processes one claimed batch. Expected failures are handled inside; a runtime exception restarts the loop, an Error ends it. */
    void runOnce();

    /** Called once on the worker thread before the first iteration. */
    default void onStart() {}
}
