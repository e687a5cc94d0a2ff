package com.glisk.backend.generation;

import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.token.entity.AuthorEntity;

public final class PromptValidator {

    private PromptValidator() {}

    /** non-empty, at most 1000 characters; returned unchanged */
    public static String validate(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new PermanentServiceException("PROMPT_INVALID", "Prompt cannot be empty");
        }
        if (prompt.length() > AuthorEntity.MAX_PROMPT_LENGTH) {
            throw new PermanentServiceException("PROMPT_INVALID",
                    "Prompt exceeds maximum length of " + AuthorEntity.MAX_PROMPT_LENGTH
                    + " characters (got " + prompt.length() + ")");
        }
        return prompt;
    }
}
