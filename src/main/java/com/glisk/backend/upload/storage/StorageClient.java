package com.glisk.backend.upload.storage;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Content-addressed storage (IPFS pinning). Both calls return the content id (CID).
 * Failures are {@link com.glisk.backend.common.error.TransientServiceException} or
 * {@link com.glisk.backend.common.error.PermanentServiceException}.
 */
public interface StorageClient {

    String uploadBytes(byte[] data, String fileName);

    String uploadJson(JsonNode json, String name);
}
