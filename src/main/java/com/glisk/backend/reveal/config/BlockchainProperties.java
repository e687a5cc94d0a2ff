package com.glisk.backend.reveal.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.blockchain")
public class BlockchainProperties {

    /** JSON-RPC endpoint (Base / Base Sepolia) */
    private String rpcUrl = "http://localhost:8545";

    /** GliskNFT contract */
    private String contractAddress;

    /** KEEPER_PRIVATE_KEY; only needed to submit reveals */
    private String keeperPrivateKey;

    private long chainId = 84532;

    /** how often a submitted transaction's receipt is polled */
    private Duration receiptPollInterval = Duration.ofSeconds(2);

    /** attempts for read RPC calls (delays 1s, 2s, 4s ...) */
    private int rpcMaxAttempts = 3;

    private Duration rpcInitialDelay = Duration.ofSeconds(1);
}
