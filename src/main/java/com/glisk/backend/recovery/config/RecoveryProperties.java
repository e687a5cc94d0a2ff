package com.glisk.backend.recovery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.recovery")
public class RecoveryProperties {

    /** owner of tokens found only on chain; also supplies the prompt when an author has none */
    private String defaultAuthorWallet;

    /** upper bound on tokens inserted by one reconcile run without an explicit limit */
    private int batchSize = 1000;
}
