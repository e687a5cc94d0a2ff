package com.glisk.backend.generation;

import com.glisk.backend.common.error.ContentPolicyException;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.generation.config.GenerationWorkerProperties;
import com.glisk.backend.generation.provider.ImageGenerationClient;
import com.glisk.backend.pipeline.config.RetryProperties;
import com.glisk.backend.pipeline.retry.RetryPolicy;
import com.glisk.backend.testsupport.InMemoryWorkerTransactions;
import com.glisk.backend.token.claim.ClaimQueue;
import com.glisk.backend.token.claim.ClaimedTokenWriter;
import com.glisk.backend.token.entity.TokenEntity;
import com.glisk.backend.token.model.TokenStatus;
import com.glisk.backend.token.repo.TokenRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

class GenerationWorkerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String PROMPT = "a lighthouse made of glass";
    private static final String IMAGE_URL = "https://replicate.delivery/pbxt/out-0.png";

    private ClaimQueue claimQueue;
    private TokenRepository tokenRepo;
    private PromptResolver promptResolver;
    private ImageGenerationClient generator;
    private GenerationWorkerProperties props;
    private GenerationWorker worker;

    /** the "table": tokens the claim stub hands out while they are DETECTED */
    private final Map<Long, TokenEntity> store = new LinkedHashMap<>();

    @BeforeEach
    void setUp() {
        claimQueue = Mockito.mock(ClaimQueue.class);
        tokenRepo = Mockito.mock(TokenRepository.class);
        promptResolver = Mockito.mock(PromptResolver.class);
        generator = Mockito.mock(ImageGenerationClient.class);
        props = new GenerationWorkerProperties();

        Mockito.when(claimQueue.claim(eq(TokenStatus.DETECTED), anyInt(), anyString())).thenAnswer(inv -> {
            String owner = inv.getArgument(2);
            List<TokenEntity> out = new ArrayList<>();
            for (TokenEntity t : store.values()) {
                if (t.getStatus() != TokenStatus.DETECTED) continue;
                t.claim(owner, NOW.plusSeconds(600));
                out.add(t);
            }
            return out;
        });
        Mockito.when(tokenRepo.findByTokenIdForUpdate(anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(store.get((Long) inv.getArgument(0))));
        Mockito.when(promptResolver.resolve(anyLong(), anyString())).thenReturn(PROMPT);

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        worker = new GenerationWorker(
                claimQueue,
                new ClaimedTokenWriter(new InMemoryWorkerTransactions(), tokenRepo),
                promptResolver,
                generator,
                new RetryPolicy(new RetryProperties()),
                props,
                clock);
    }

    private TokenEntity detected(long tokenId) {
        TokenEntity t = TokenEntity.detected(tokenId, "author-" + tokenId);
        store.put(tokenId, t);
        return t;
    }

    @Test
    void success_should_move_token_to_uploading() {
        TokenEntity t = detected(7L);
        Mockito.when(generator.generate(PROMPT)).thenReturn(IMAGE_URL);

        worker.runOnce();

        assertEquals(TokenStatus.UPLOADING, t.getStatus());
        assertEquals(IMAGE_URL, t.getImageUrl());
        assertEquals(1, t.getGenerationAttempts());
        assertNull(t.getClaimedBy());
    }

    @Test
    void transient_failures_then_success_should_end_in_uploading() {
        TokenEntity t = detected(7L);
        Mockito.when(generator.generate(PROMPT))
                .thenThrow(new TransientServiceException("GENERATION_RATE_LIMITED", "slow down"))
                .thenThrow(new TransientServiceException("GENERATION_UPSTREAM_5XX", "upstream 503"))
                .thenReturn(IMAGE_URL);

        worker.runOnce();
        assertEquals(TokenStatus.DETECTED, t.getStatus());
        assertEquals(NOW.plusSeconds(1), t.getNextAttemptAt());
        assertNull(t.getClaimedBy());

        worker.runOnce();
        assertEquals(TokenStatus.DETECTED, t.getStatus());
        assertEquals(NOW.plusSeconds(2), t.getNextAttemptAt());

        worker.runOnce();
        assertEquals(TokenStatus.UPLOADING, t.getStatus());
        assertEquals(3, t.getGenerationAttempts());
        assertNull(t.getGenerationError());
        assertNull(t.getNextAttemptAt());
    }

    @Test
    void reach_max_attempts_should_fail() {
        TokenEntity t = detected(7L);
        Mockito.when(generator.generate(PROMPT))
                .thenThrow(new TransientServiceException("GENERATION_TIMEOUT", "read timed out"));

        for (int i = 0; i < props.getMaxAttempts() + 1; i++) worker.runOnce();

        assertEquals(TokenStatus.FAILED, t.getStatus());
        assertEquals(3, t.getGenerationAttempts());
        assertTrue(t.getGenerationError().startsWith("Max attempts (3) reached"));
        assertTrue(t.getGenerationError().contains("GENERATION_TIMEOUT"));
        Mockito.verify(generator, times(3)).generate(PROMPT);
    }

    @Test
    void token_returned_by_reaper_with_attempts_used_up_should_fail_without_calling_provider() {
        TokenEntity t = detected(7L);
        t.setGenerationAttempts(props.getMaxAttempts());
        Mockito.when(generator.generate(anyString())).thenReturn(IMAGE_URL);

        worker.runOnce();

        assertEquals(TokenStatus.FAILED, t.getStatus());
        assertEquals(3, t.getGenerationAttempts());
        assertTrue(t.getGenerationError().startsWith("Max attempts (3) reached"));
        assertNull(t.getClaimedBy());
        Mockito.verifyNoInteractions(generator, promptResolver);
    }

    @Test
    void content_policy_should_retry_once_with_fallback_prompt() {
        TokenEntity t = detected(7L);
        Mockito.when(generator.generate(PROMPT)).thenThrow(new ContentPolicyException("NSFW content detected"));
        Mockito.when(generator.generate(props.getFallbackPrompt())).thenReturn(IMAGE_URL);

        worker.runOnce();

        assertEquals(TokenStatus.UPLOADING, t.getStatus());
        assertEquals(IMAGE_URL, t.getImageUrl());
        assertEquals(1, t.getGenerationAttempts());
        Mockito.verify(generator, times(1)).generate(props.getFallbackPrompt());
    }

    @Test
    void fallback_rejected_as_well_should_fail() {
        TokenEntity t = detected(7L);
        Mockito.when(generator.generate(anyString())).thenThrow(new ContentPolicyException("safety checker"));

        worker.runOnce();

        assertEquals(TokenStatus.FAILED, t.getStatus());
        assertTrue(t.getGenerationError().startsWith("Fallback prompt failed"));
    }

    @Test
    void permanent_error_should_fail_without_retry() {
        TokenEntity t = detected(7L);
        Mockito.when(generator.generate(PROMPT))
                .thenThrow(new PermanentServiceException("GENERATION_AUTH_FAILED", "auth failed (401)"));

        worker.runOnce();
        worker.runOnce();

        assertEquals(TokenStatus.FAILED, t.getStatus());
        assertEquals("GENERATION_AUTH_FAILED: auth failed (401)", t.getGenerationError());
        Mockito.verify(generator, times(1)).generate(anyString());
    }

    @Test
    void invalid_prompt_should_fail_without_calling_provider() {
        TokenEntity t = detected(7L);
        Mockito.when(promptResolver.resolve(anyLong(), anyString()))
                .thenThrow(new PermanentServiceException("PROMPT_INVALID", "Prompt cannot be empty"));

        worker.runOnce();

        assertEquals(TokenStatus.FAILED, t.getStatus());
        assertEquals("Prompt validation failed: PROMPT_INVALID: Prompt cannot be empty", t.getGenerationError());
        Mockito.verifyNoInteractions(generator);
    }

    @Test
    void lost_claim_should_leave_token_untouched() {
        TokenEntity t = detected(7L);
        Mockito.when(tokenRepo.findByTokenIdForUpdate(7L)).thenAnswer(inv -> {
            t.claim("generation@other-host:99", NOW.plusSeconds(600));
            return Optional.of(t);
        });

        worker.runOnce();

        assertEquals(TokenStatus.DETECTED, t.getStatus());
        assertEquals(0, t.getGenerationAttempts());
        Mockito.verifyNoInteractions(generator);
        Mockito.verify(tokenRepo, never()).save(any());
    }

    @Test
    void unexpected_error_should_release_rest_of_batch_and_propagate() {
        detected(7L);
        detected(8L);
        Mockito.when(generator.generate(PROMPT)).thenThrow(new IllegalStateException("bug"));

        assertThrows(IllegalStateException.class, () -> worker.runOnce());

        Mockito.verify(claimQueue).release(List.of(8L));
    }
}
