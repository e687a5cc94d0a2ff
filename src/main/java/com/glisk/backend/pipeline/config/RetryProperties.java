package com.glisk.backend.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.pipeline.retry")
public class RetryProperties {

    /** first retry delay; doubles per attempt (1s, 2s, 4s ...) */
    private Duration baseDelay = Duration.ofSeconds(1);

    private Duration maxDelay = Duration.ofSeconds(60);
}
