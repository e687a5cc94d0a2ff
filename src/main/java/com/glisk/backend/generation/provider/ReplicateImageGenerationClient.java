package com.glisk.backend.generation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glisk.backend.common.error.ContentPolicyException;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.common.error.ServiceErrorMapper;
import com.glisk.backend.common.error.ServiceException;
import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.generation.config.ReplicateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Replicate predictions API.
 * <pre>
 * POST /v1/predictions   {"version": ..., "input": {"prompt": ...}}   Prefer: wait
 * GET  /v1/predictions/{id}   until status is succeeded | failed | canceled
 * </pre>
 */
@Slf4j
public class ReplicateImageGenerationClient implements ImageGenerationClient {

    private static final String CODE_PREFIX = "GENERATION";

    private final RestClient http;
    private final ReplicateProperties props;
    private final ObjectMapper om;

    public ReplicateImageGenerationClient(RestClient http, ReplicateProperties props, ObjectMapper om) {
        this.http = http;
        this.props = props;
        this.om = om;
    }

    @Override
    public String generate(String prompt) {
        long t0 = System.nanoTime();
        try {
            JsonNode prediction = create(prompt);
            long deadline = t0 + props.getMaxWait().toNanos();

            while (!isFinal(prediction)) {
                if (System.nanoTime() > deadline) {
                    throw new TransientServiceException(CODE_PREFIX + "_TIMEOUT",
                            "prediction " + prediction.path("id").asText() + " not finished after " + props.getMaxWait());
                }
                sleep();
                prediction = fetch(prediction.path("id").asText());
            }

            String url = extractOutputUrl(prediction);
            log.info("replicate.ok predictionId={} tookMs={}",
                    prediction.path("id").asText(), (System.nanoTime() - t0) / 1_000_000);
            return url;
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ServiceErrorMapper.map(CODE_PREFIX, e);
        }
    }

    private JsonNode create(String prompt) {
        Map<String, Object> body = Map.of(
                "version", props.getModelVersion(),
                "input", Map.of("prompt", prompt)
        );
        String raw = http.post()
                .uri("/v1/predictions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .header("Prefer", "wait")
                .body(body)
                .retrieve()
                .body(String.class);
        return parse(raw);
    }

    private JsonNode fetch(String id) {
        String raw = http.get()
                .uri("/v1/predictions/{id}", id)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(String.class);
        return parse(raw);
    }

    private JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new TransientServiceException(CODE_PREFIX + "_EMPTY_RESPONSE", "empty body from replicate");
        }
        try {
            return om.readTree(raw);
        } catch (Exception e) {
            throw new TransientServiceException(CODE_PREFIX + "_BAD_RESPONSE", "unparseable replicate body", null, e);
        }
    }

    private static boolean isFinal(JsonNode p) {
        String s = p.path("status").asText("");
        return s.equals("succeeded") || s.equals("failed") || s.equals("canceled");
    }

    private static String extractOutputUrl(JsonNode p) {
        String status = p.path("status").asText("");
        if (!status.equals("succeeded")) {
            String err = p.path("error").asText("prediction " + status);
            if (ServiceErrorMapper.isContentPolicyText(err)) {
                throw new ContentPolicyException(err);
            }
            throw new PermanentServiceException(CODE_PREFIX + "_PREDICTION_FAILED", err);
        }

        JsonNode out = p.path("output");
        String url = null;
        if (out.isTextual()) url = out.asText();
        else if (out.isArray() && out.size() > 0) url = out.get(0).asText(null);

        if (url == null || url.isBlank()) {
            throw new PermanentServiceException(CODE_PREFIX + "_NO_OUTPUT", "prediction succeeded without an output url");
        }
        return url;
    }

    private void sleep() {
        try {
            Thread.sleep(props.getPollInterval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RestClientException("interrupted while waiting for prediction", e);
        }
    }
}
