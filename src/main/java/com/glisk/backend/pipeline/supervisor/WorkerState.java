package com.glisk.backend.pipeline.supervisor;

import java.time.Instant;

public record WorkerState(
        String name,
        boolean running,
        long iterations,
        long restarts,
        Instant lastSuccessAt,
        String lastError
) {}
