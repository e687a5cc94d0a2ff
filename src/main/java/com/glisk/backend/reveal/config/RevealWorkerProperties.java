package com.glisk.backend.reveal.config;

import com.glisk.backend.reveal.chain.GasStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.pipeline.reveal")
public class RevealWorkerProperties {

    private Duration pollInterval = Duration.ofSeconds(1);

    /** tokens per reveal transaction */
    private int maxBatchTokens = 50;

    /** a partial batch waits this long for more READY tokens before it is submitted */
    private Duration batchWait = Duration.ofSeconds(5);

    private Duration transactionTimeout = Duration.ofSeconds(180);

    private GasStrategy gasStrategy = GasStrategy.MEDIUM;

    /** multiplier on estimated gas limit and priority fee */
    private double gasBuffer = 1.2;
}
