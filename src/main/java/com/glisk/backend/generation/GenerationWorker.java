package com.glisk.backend.generation;

import com.glisk.backend.common.error.ContentPolicyException;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.common.error.ServiceException;
import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.generation.config.GenerationWorkerProperties;
import com.glisk.backend.generation.provider.ImageGenerationClient;
import com.glisk.backend.pipeline.retry.RetryPolicy;
import com.glisk.backend.pipeline.supervisor.PipelineWorker;
import com.glisk.backend.token.claim.ClaimQueue;
import com.glisk.backend.token.claim.ClaimedTokenWriter;
import com.glisk.backend.token.claim.WorkerIdentity;
import com.glisk.backend.token.entity.TokenEntity;
import com.glisk.backend.token.model.TokenStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DETECTED -> GENERATING -> UPLOADING.
 * <p>
 * Each token goes through several commits: the attempt is recorded first, then the outcome.
 * A transient failure puts the token back to DETECTED with a backoff; it is picked up again by a
 * later claim. The attempt counter is what bounds the retries.
 */
@Slf4j
@Component
public class GenerationWorker implements PipelineWorker {

    private final ClaimQueue claimQueue;
    private final ClaimedTokenWriter writer;
    private final PromptResolver promptResolver;
    private final ImageGenerationClient generator;
    private final RetryPolicy retryPolicy;
    private final GenerationWorkerProperties props;
    private final Clock clock;
    private final String owner = WorkerIdentity.of("generation");

    public GenerationWorker(ClaimQueue claimQueue,
                            ClaimedTokenWriter writer,
                            PromptResolver promptResolver,
                            ImageGenerationClient generator,
                            RetryPolicy retryPolicy,
                            GenerationWorkerProperties props,
                            Clock clock) {
        this.claimQueue = claimQueue;
        this.writer = writer;
        this.promptResolver = promptResolver;
        this.generator = generator;
        this.retryPolicy = retryPolicy;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String name() { return "generation"; }

    @Override
    public Duration pollInterval() { return props.getPollInterval(); }

    public String owner() { return owner; }

    @Override
    public void runOnce() {
        List<TokenEntity> batch = claimQueue.claim(TokenStatus.DETECTED, props.getBatchSize(), owner);
        if (batch.isEmpty()) return;

        log.debug("generation.batch size={}", batch.size());

        for (int i = 0; i < batch.size(); i++) {
            try {
                process(batch.get(i).getTokenId());
            } catch (RuntimeException e) {
                // the token in flight keeps its lease until the reaper returns it; the rest go back now
                releaseRemaining(batch, i + 1);
                throw e;
            }
        }
    }

    void process(long tokenId) {
        long t0 = System.nanoTime();

        int max = props.getMaxAttempts();
        Optional<TokenEntity> started = writer.update(tokenId, owner, t -> {
            if (t.getGenerationAttempts() >= max) {
                t.failGenerationExhausted("Max attempts (" + max + ") reached: interrupted run", clock.instant());
            } else {
                t.markGenerating(clock.instant());
            }
        });
        if (started.isEmpty()) return;
        if (started.get().getStatus() == TokenStatus.FAILED) {
            log.error("token.generation.failed tokenId={} attempt={} error={}",
                    tokenId, started.get().getGenerationAttempts(), started.get().getGenerationError());
            return;
        }

        int attempt = started.get().getGenerationAttempts();
        log.info("token.generation.started tokenId={} attempt={}", tokenId, attempt);

        String prompt;
        try {
            prompt = promptResolver.resolve(tokenId, started.get().getAuthorId());
        } catch (PermanentServiceException e) {
            fail(tokenId, attempt, "Prompt validation failed: " + e.describe());
            return;
        }

        try {
            String imageUrl = generator.generate(prompt);
            succeed(tokenId, attempt, imageUrl, false, t0);
        } catch (ContentPolicyException e) {
            log.warn("token.censored tokenId={} attempt={} reason={}", tokenId, attempt, e.getMessage());
            retryWithFallback(tokenId, attempt, e, t0);
        } catch (TransientServiceException e) {
            retryLater(tokenId, attempt, e);
        } catch (PermanentServiceException e) {
            fail(tokenId, attempt, e.describe());
        }
    }

    private void retryWithFallback(long tokenId, int attempt, ContentPolicyException original, long t0) {
        try {
            String imageUrl = generator.generate(props.getFallbackPrompt());
            succeed(tokenId, attempt, imageUrl, true, t0);
        } catch (TransientServiceException e) {
            retryLater(tokenId, attempt, e);
        } catch (ServiceException e) {
            fail(tokenId, attempt, "Fallback prompt failed: " + e.describe() + " (original: " + original.getMessage() + ")");
        }
    }

    private void succeed(long tokenId, int attempt, String imageUrl, boolean fallbackUsed, long t0) {
        writer.update(tokenId, owner, t -> t.markUploading(imageUrl, clock.instant()));
        log.info("token.generation.succeeded tokenId={} attempt={} fallbackUsed={} tookMs={}",
                tokenId, attempt, fallbackUsed, (System.nanoTime() - t0) / 1_000_000);
    }

    private void retryLater(long tokenId, int attempt, TransientServiceException e) {
        Instant now = clock.instant();

        if (retryPolicy.shouldGiveUp(attempt, props.getMaxAttempts())) {
            fail(tokenId, attempt, "Max attempts (" + props.getMaxAttempts() + ") reached: " + e.describe());
            return;
        }

        Instant retryAt = retryPolicy.nextAttemptAt(now, attempt, e);
        writer.update(tokenId, owner, t -> t.scheduleGenerationRetry(retryAt, now));
        log.warn("token.generation.retry tokenId={} attempt={} code={} retryAt={}",
                tokenId, attempt, e.code(), retryAt);
    }

    private void fail(long tokenId, int attempt, String error) {
        writer.update(tokenId, owner, t -> t.markFailed(error, clock.instant()));
        log.error("token.generation.failed tokenId={} attempt={} error={}", tokenId, attempt, error);
    }

    private void releaseRemaining(List<TokenEntity> batch, int from) {
        List<Long> rest = new ArrayList<>();
        for (int j = from; j < batch.size(); j++) rest.add(batch.get(j).getTokenId());
        if (rest.isEmpty()) return;
        try {
            claimQueue.release(rest);
        } catch (RuntimeException re) {
            log.warn("claim.release.failed tokenIds={} (leases will expire)", rest, re);
        }
    }
}
