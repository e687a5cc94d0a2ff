package com.glisk.backend.upload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.pipeline.upload")
public class UploadWorkerProperties {

    private Duration pollInterval = Duration.ofSeconds(1);

    private int batchSize = 10;

    /** same bound as generation, counted on upload_attempts */
    private int maxAttempts = 3;

    /** timeout for fetching the generated image */
    private Duration downloadTimeout = Duration.ofSeconds(30);
}
