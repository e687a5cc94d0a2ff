package com.glisk.backend.generation.provider;

/**
 * AI image generation.
 * Throws {@link com.glisk.backend.common.error.TransientServiceException},
 * {@link com.glisk.backend.common.error.ContentPolicyException} or
 * {@link com.glisk.backend.common.error.PermanentServiceException}.
 */
public interface ImageGenerationClient {

    /** @return public URL of the generated image */
    String generate(String prompt);
}
