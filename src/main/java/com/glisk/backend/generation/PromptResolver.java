package com.glisk.backend.generation;

import com.glisk.backend.common.error.DefaultAuthorNotFoundException;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.recovery.config.RecoveryProperties;
import com.glisk.backend.token.entity.AuthorEntity;
import com.glisk.backend.token.repo.AuthorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Prompt for a token: its author's prompt, or the default author's when the author row
 * or its prompt is missing. The result is validated.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class PromptResolver {

    private final AuthorRepository authorRepo;
    private final RecoveryProperties recoveryProps;

    public String resolve(long tokenId, String authorId) {
        Optional<AuthorEntity> author = authorId == null ? Optional.empty() : authorRepo.findById(authorId);

        if (author.isPresent() && author.get().hasPrompt()) {
            return PromptValidator.validate(author.get().getPromptText());
        }

        if (author.isEmpty()) {
            log.warn("author.not_found.using_default tokenId={} authorId={}", tokenId, authorId);
        } else {
            log.info("author.prompt_unset.using_default tokenId={} wallet={}", tokenId, author.get().getWalletAddress());
        }

        String wallet = recoveryProps.getDefaultAuthorWallet();
        AuthorEntity fallback;
        try {
            fallback = authorRepo.findByWallet(wallet).orElseThrow(() -> new DefaultAuthorNotFoundException(wallet));
        } catch (IllegalArgumentException e) {
            throw new DefaultAuthorNotFoundException(wallet);
        }
        if (!fallback.hasPrompt()) {
            throw new PermanentServiceException("DEFAULT_AUTHOR_NO_PROMPT",
                    "Default author " + wallet + " has no prompt");
        }
        return PromptValidator.validate(fallback.getPromptText());
    }
}
