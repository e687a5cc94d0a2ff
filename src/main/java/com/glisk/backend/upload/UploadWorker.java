package com.glisk.backend.upload;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.common.error.ServiceException;
import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.pipeline.retry.RetryPolicy;
import com.glisk.backend.pipeline.supervisor.PipelineWorker;
import com.glisk.backend.token.claim.ClaimQueue;
import com.glisk.backend.token.claim.ClaimedTokenWriter;
import com.glisk.backend.token.claim.WorkerIdentity;
import com.glisk.backend.token.entity.IpfsUploadRecordEntity;
import com.glisk.backend.token.entity.IpfsUploadRecordEntity.RecordType;
import com.glisk.backend.token.entity.TokenEntity;
import com.glisk.backend.token.model.TokenStatus;
import com.glisk.backend.token.repo.IpfsUploadRecordRepository;
import com.glisk.backend.upload.config.UploadWorkerProperties;
import com.glisk.backend.upload.storage.ImageDownloader;
import com.glisk.backend.upload.storage.StorageClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * UPLOADING -> READY: pin the image, build and pin the metadata, store both CIDs.
 * A transient failure keeps the token in UPLOADING with a backoff until upload_attempts
 * reaches the limit.
 */
@Slf4j
@Component
public class UploadWorker implements PipelineWorker {

    private final ClaimQueue claimQueue;
    private final ClaimedTokenWriter writer;
    private final ImageDownloader downloader;
    private final StorageClient storage;
    private final TokenMetadataBuilder metadataBuilder;
    private final IpfsUploadRecordRepository recordRepo;
    private final RetryPolicy retryPolicy;
    private final UploadWorkerProperties props;
    private final Clock clock;
    private final String owner = WorkerIdentity.of("upload");

    public UploadWorker(ClaimQueue claimQueue,
                        ClaimedTokenWriter writer,
                        ImageDownloader downloader,
                        StorageClient storage,
                        TokenMetadataBuilder metadataBuilder,
                        IpfsUploadRecordRepository recordRepo,
                        RetryPolicy retryPolicy,
                        UploadWorkerProperties props,
                        Clock clock) {
        this.claimQueue = claimQueue;
        this.writer = writer;
        this.downloader = downloader;
        this.storage = storage;
        this.metadataBuilder = metadataBuilder;
        this.recordRepo = recordRepo;
        this.retryPolicy = retryPolicy;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String name() { return "upload"; }

    @Override
    public Duration pollInterval() { return props.getPollInterval(); }

    public String owner() { return owner; }

    @Override
    public void runOnce() {
        List<TokenEntity> batch = claimQueue.claim(TokenStatus.UPLOADING, props.getBatchSize(), owner);
        if (batch.isEmpty()) return;

        for (int i = 0; i < batch.size(); i++) {
            try {
                process(batch.get(i).getTokenId());
            } catch (RuntimeException e) {
                List<Long> rest = new ArrayList<>();
                for (int j = i; j < batch.size(); j++) rest.add(batch.get(j).getTokenId());
                try {
                    claimQueue.release(rest);
                } catch (RuntimeException re) {
                    log.warn("claim.release.failed tokenIds={} (leases will expire)", rest, re);
                }
                throw e;
            }
        }
    }

    void process(long tokenId) {
        long t0 = System.nanoTime();

        int max = props.getMaxAttempts();
        Optional<TokenEntity> started = writer.update(tokenId, owner, t -> {
            if (t.getUploadAttempts() >= max) {
                // lease expired during the last allowed attempt
                t.markFailed("Max IPFS retries (" + max + ") exceeded: interrupted run", clock.instant());
            } else {
                t.markUploadAttempt(clock.instant());
            }
        });
        if (started.isEmpty()) return;
        if (started.get().getStatus() == TokenStatus.FAILED) {
            log.error("ipfs.upload.failed tokenId={} attempt={} error={}",
                    tokenId, started.get().getUploadAttempts(), started.get().getGenerationError());
            return;
        }

        int attempt = started.get().getUploadAttempts();
        String imageUrl = started.get().getImageUrl();
        log.info("ipfs.upload.started tokenId={} attempt={}", tokenId, attempt);

        RecordType stage = RecordType.IMAGE;
        try {
            byte[] image = downloader.download(imageUrl);
            String imageCid = storage.uploadBytes(image, TokenMetadataBuilder.imageFileName(tokenId));
            log.info("ipfs.image_uploaded tokenId={} cid={}", tokenId, imageCid);

            stage = RecordType.METADATA;
            ObjectNode metadata = metadataBuilder.build(tokenId, imageCid);
            String metadataCid = storage.uploadJson(metadata, TokenMetadataBuilder.metadataFileName(tokenId));
            log.info("ipfs.metadata_uploaded tokenId={} cid={}", tokenId, metadataCid);

            int retries = attempt - 1;
            writer.update(tokenId, owner, t -> {
                t.markReady(imageCid, metadataCid, clock.instant());
                recordRepo.save(IpfsUploadRecordEntity.completed(tokenId, RecordType.IMAGE, imageCid, retries));
                recordRepo.save(IpfsUploadRecordEntity.completed(tokenId, RecordType.METADATA, metadataCid, retries));
            });
            log.info("ipfs.upload.succeeded tokenId={} attempt={} tookMs={}",
                    tokenId, attempt, (System.nanoTime() - t0) / 1_000_000);

        } catch (TransientServiceException e) {
            retryLater(tokenId, attempt, stage, e);
        } catch (PermanentServiceException e) {
            fail(tokenId, attempt, stage, "IPFS upload failed: " + e.describe());
        } catch (ServiceException e) {
            // content-policy has no meaning here; treat as permanent
            fail(tokenId, attempt, stage, "IPFS upload failed: " + e.describe());
        }
    }

    private void retryLater(long tokenId, int attempt, RecordType stage, TransientServiceException e) {
        if (retryPolicy.shouldGiveUp(attempt, props.getMaxAttempts())) {
            fail(tokenId, attempt, stage, "Max IPFS retries (" + props.getMaxAttempts() + ") exceeded: " + e.describe());
            return;
        }

        Instant now = clock.instant();
        Instant retryAt = retryPolicy.nextAttemptAt(now, attempt, e);
        writer.update(tokenId, owner, t -> t.scheduleUploadRetry(retryAt, now));
        log.warn("ipfs.transient_error tokenId={} attempt={} maxAttempts={} code={} retryAt={}",
                tokenId, attempt, props.getMaxAttempts(), e.code(), retryAt);
    }

    private void fail(long tokenId, int attempt, RecordType stage, String error) {
        writer.update(tokenId, owner, t -> {
            t.markFailed(error, clock.instant());
            recordRepo.save(IpfsUploadRecordEntity.failed(tokenId, stage, error, attempt - 1));
        });
        log.error("ipfs.upload.failed tokenId={} attempt={} stage={} error={}", tokenId, attempt, stage, error);
    }
}
