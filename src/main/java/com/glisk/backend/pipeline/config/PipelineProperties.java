package com.glisk.backend.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /** start the worker loops on boot (tests turn this off) */
    private boolean enabled = true;

    /** wait before restarting a worker loop that died on an unexpected exception */
    private Duration restartDelay = Duration.ofSeconds(5);

    /** how long a claim stays active without a status flip */
    private Duration claimLease = Duration.ofMinutes(10);

    /** how long shutdown waits for in-flight iterations (reveal confirmation included) */
    private Duration shutdownTimeout = Duration.ofMinutes(4);
}
