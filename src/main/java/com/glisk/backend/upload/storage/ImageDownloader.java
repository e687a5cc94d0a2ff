package com.glisk.backend.upload.storage;

/**
 * Fetches the bytes of a generated image by the URL the generation stage stored.
 * Errors are {@link com.glisk.backend.common.error.ServiceException}s like the other clients.
 */
public interface ImageDownloader {

    byte[] download(String imageUrl);
}
