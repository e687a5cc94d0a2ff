package com.glisk.backend.upload.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glisk.backend.upload.storage.HttpImageDownloader;
import com.glisk.backend.upload.storage.ImageDownloader;
import com.glisk.backend.upload.storage.PinataStorageClient;
import com.glisk.backend.upload.storage.StorageClient;
import com.glisk.backend.upload.storage.StubImageDownloader;
import com.glisk.backend.upload.storage.StubStorageClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties({PinataProperties.class, UploadWorkerProperties.class})
public class UploadConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.storage.pinata", name = "enabled", havingValue = "false", matchIfMissing = true)
    public StorageClient stubStorageClient() {
        return new StubStorageClient();
    }

    @Bean("pinataRestClient")
    @ConditionalOnProperty(prefix = "app.storage.pinata", name = "enabled", havingValue = "true")
    public RestClient pinataRestClient(PinataProperties props) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getJwt())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.storage.pinata", name = "enabled", havingValue = "true")
    public StorageClient pinataStorageClient(RestClient pinataRestClient, PinataProperties props, ObjectMapper om) {
        if (props.getJwt() == null || props.getJwt().isBlank()) {
            throw new IllegalStateException("PINATA_JWT_MISSING");
        }
        return new PinataStorageClient(pinataRestClient, props, om);
    }

    /**
     * The downloader follows the generator: stub image urls only exist when replicate is off.
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.provider.replicate", name = "enabled", havingValue = "false", matchIfMissing = true)
    public ImageDownloader stubImageDownloader() {
        return new StubImageDownloader();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.replicate", name = "enabled", havingValue = "true")
    public ImageDownloader httpImageDownloader(UploadWorkerProperties props) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.getDownloadTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getDownloadTimeout());

        return new HttpImageDownloader(RestClient.builder()
                .requestFactory(rf)
                .build());
    }
}
