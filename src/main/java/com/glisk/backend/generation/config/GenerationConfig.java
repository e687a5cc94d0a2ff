package com.glisk.backend.generation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glisk.backend.generation.provider.ImageGenerationClient;
import com.glisk.backend.generation.provider.ReplicateImageGenerationClient;
import com.glisk.backend.generation.provider.StubImageGenerationClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties({ReplicateProperties.class, GenerationWorkerProperties.class})
public class GenerationConfig {

    /**
     * Only when replicate is disabled, so there is never more than one ImageGenerationClient bean.
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.provider.replicate", name = "enabled", havingValue = "false", matchIfMissing = true)
    public ImageGenerationClient stubImageGenerationClient() {
        return new StubImageGenerationClient();
    }

    @Bean("replicateRestClient")
    @ConditionalOnProperty(prefix = "app.provider.replicate", name = "enabled", havingValue = "true")
    public RestClient replicateRestClient(ReplicateProperties props) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiToken())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.replicate", name = "enabled", havingValue = "true")
    public ImageGenerationClient replicateImageGenerationClient(RestClient replicateRestClient,
                                                                ReplicateProperties props,
                                                                ObjectMapper om) {
        // fail fast at boot
        if (props.getApiToken() == null || props.getApiToken().isBlank()) {
            throw new IllegalStateException("REPLICATE_API_TOKEN_MISSING");
        }
        if (props.getModelVersion() == null || props.getModelVersion().isBlank()) {
            throw new IllegalStateException("REPLICATE_MODEL_VERSION_MISSING");
        }
        return new ReplicateImageGenerationClient(replicateRestClient, props, om);
    }
}
