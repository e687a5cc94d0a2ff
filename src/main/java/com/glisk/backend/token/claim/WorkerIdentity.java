package com.glisk.backend.token.claim;

import java.lang.management.ManagementFactory;
import java.util.UUID;

/** {@code claimed_by} value: {@code <worker>@<jvm-name>/<random>}, unique per worker instance. */
public final class WorkerIdentity {

    private WorkerIdentity() {}

    public static String of(String workerName) {
        String jvm = ManagementFactory.getRuntimeMXBean().getName();
        String id = workerName + "@" + jvm + "/" + UUID.randomUUID().toString().substring(0, 8);
        return id.length() <= 64 ? id : id.substring(0, 64);
    }
}
