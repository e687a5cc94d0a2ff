package com.glisk.backend.upload.storage;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Fake CIDs derived from the content hash, so the same bytes always map to the same id. */
@Slf4j
public class StubStorageClient implements StorageClient {

    @Override
    public String uploadBytes(byte[] data, String fileName) {
        String cid = fakeCid(data);
        log.debug("stub.upload file={} bytes={} cid={}", fileName, data.length, cid);
        return cid;
    }

    @Override
    public String uploadJson(JsonNode json, String name) {
        String cid = fakeCid(json.toString().getBytes(StandardCharsets.UTF_8));
        log.debug("stub.upload json={} cid={}", name, cid);
        return cid;
    }

    private static String fakeCid(byte[] data) {
        try {
            byte[] h = MessageDigest.getInstance("SHA-256").digest(data);
            return "bafkstub" + HexFormat.of().formatHex(h, 0, 20);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
