package com.glisk.backend.generation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.pipeline.generation")
public class GenerationWorkerProperties {

    private Duration pollInterval = Duration.ofSeconds(1);

    /** tokens claimed per iteration */
    private int batchSize = 10;

    /** attempts before a token goes FAILED */
    private int maxAttempts = 3;

    /** used once when the author's prompt is rejected by the content filter */
    private String fallbackPrompt = "A serene abstract landscape with soft gradients of color, minimal and calm";
}
