package com.glisk.backend.reveal.config;

import com.glisk.backend.reveal.chain.BlockchainClient;
import com.glisk.backend.reveal.chain.Web3jBlockchainClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
@EnableConfigurationProperties({BlockchainProperties.class, RevealWorkerProperties.class})
public class BlockchainConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(BlockchainProperties props) {
        return Web3j.build(new HttpService(props.getRpcUrl()));
    }

    @Bean
    public BlockchainClient blockchainClient(Web3j web3j, BlockchainProperties props) {
        return new Web3jBlockchainClient(web3j, props);
    }
}
