package com.glisk.backend.upload.storage;

import com.glisk.backend.common.error.PermanentServiceException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/** Paired with the stub generator, whose URLs point nowhere: placeholder bytes derived from the URL. */
@Slf4j
public class StubImageDownloader implements ImageDownloader {

    @Override
    public byte[] download(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new PermanentServiceException("IMAGE_URL_MISSING", "token has no image_url");
        }
        log.debug("stub.download url={}", imageUrl);
        return ("stub-image:" + imageUrl).getBytes(StandardCharsets.UTF_8);
    }
}
