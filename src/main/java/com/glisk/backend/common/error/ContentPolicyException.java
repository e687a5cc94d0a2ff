package com.glisk.backend.common.error;

/** The generation service refused the prompt (NSFW / safety filter). */
public class ContentPolicyException extends ServiceException {

    public ContentPolicyException(String message) {
        this(message, null);
    }

    public ContentPolicyException(String message, Throwable cause) {
        super("CONTENT_POLICY_VIOLATION", message, cause);
    }
}
