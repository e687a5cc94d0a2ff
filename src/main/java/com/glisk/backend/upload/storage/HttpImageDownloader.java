package com.glisk.backend.upload.storage;

import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.common.error.ServiceErrorMapper;
import org.springframework.web.client.RestClient;

import java.net.URI;

/** Downloads generated images from the generation provider's CDN. */
public class HttpImageDownloader implements ImageDownloader {

    private static final String CODE_PREFIX = "DOWNLOAD";

    private final RestClient http;

    public HttpImageDownloader(RestClient http) {
        this.http = http;
    }

    @Override
    public byte[] download(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new PermanentServiceException("IMAGE_URL_MISSING", "token has no image_url");
        }

        byte[] bytes;
        try {
            bytes = http.get()
                    .uri(URI.create(imageUrl))
                    .retrieve()
                    .body(byte[].class);
        } catch (IllegalArgumentException e) {
            throw new PermanentServiceException("IMAGE_URL_INVALID", imageUrl, e);
        } catch (RuntimeException e) {
            throw ServiceErrorMapper.map(CODE_PREFIX, e);
        }

        if (bytes == null || bytes.length == 0) {
            throw new PermanentServiceException("EMPTY_IMAGE", "downloaded image is empty: " + imageUrl);
        }
        return bytes;
    }
}
