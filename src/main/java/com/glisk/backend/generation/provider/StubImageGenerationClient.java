package com.glisk.backend.generation.provider;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/** Used when replicate is disabled: returns a deterministic placeholder URL per prompt. */
@Slf4j
public class StubImageGenerationClient implements ImageGenerationClient {

    static final String URL_PREFIX = "https://stub.glisk.local/images/";

    @Override
    public String generate(String prompt) {
        String key = UUID.nameUUIDFromBytes(prompt.getBytes(StandardCharsets.UTF_8)).toString();
        log.debug("stub.generate promptLength={} key={}", prompt.length(), key);
        return URL_PREFIX + key + ".png";
    }
}
