package com.glisk.backend.reveal;

import com.glisk.backend.common.error.ServiceException;
import com.glisk.backend.pipeline.supervisor.PipelineWorker;
import com.glisk.backend.pipeline.tx.WorkerTransaction;
import com.glisk.backend.pipeline.tx.WorkerTransactions;
import com.glisk.backend.reveal.chain.BlockchainClient;
import com.glisk.backend.reveal.chain.ConfirmationResult;
import com.glisk.backend.reveal.chain.RevealHandle;
import com.glisk.backend.reveal.config.RevealWorkerProperties;
import com.glisk.backend.token.claim.ClaimQueue;
import com.glisk.backend.token.claim.WorkerIdentity;
import com.glisk.backend.token.entity.RevealTransactionEntity;
import com.glisk.backend.token.entity.TokenEntity;
import com.glisk.backend.token.model.TokenStatus;
import com.glisk.backend.token.repo.RevealTransactionRepository;
import com.glisk.backend.token.repo.TokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * READY -> REVEALED, one transaction per batch.
 * <p>
 * A partial batch waits {@code batch-wait} for more READY tokens before submitting. The batch
 * advances as a unit: on confirmation every token is REVEALED with the shared tx hash in one
 * commit; on revert, timeout or submission error every token stays READY and its claim is
 * released. This stage never marks a token FAILED.
 */
@Slf4j
@Component
public class RevealWorker implements PipelineWorker {

    private final ClaimQueue claimQueue;
    private final BlockchainClient chain;
    private final WorkerTransactions txs;
    private final TokenRepository tokenRepo;
    private final RevealTransactionRepository revealTxRepo;
    private final RevealWorkerProperties props;
    private final Clock clock;
    private final String owner = WorkerIdentity.of("reveal");

    public RevealWorker(ClaimQueue claimQueue,
                        BlockchainClient chain,
                        WorkerTransactions txs,
                        TokenRepository tokenRepo,
                        RevealTransactionRepository revealTxRepo,
                        RevealWorkerProperties props,
                        Clock clock) {
        this.claimQueue = claimQueue;
        this.chain = chain;
        this.txs = txs;
        this.tokenRepo = tokenRepo;
        this.revealTxRepo = revealTxRepo;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String name() { return "reveal"; }

    @Override
    public Duration pollInterval() { return props.getPollInterval(); }

    public String owner() { return owner; }

    @Override
    public void onStart() {
        recoverPendingTransactions();
    }

    @Override
    public void runOnce() {
        List<TokenEntity> batch = accumulateBatch();
        if (batch.isEmpty()) return;

        List<Long> ids = new ArrayList<>(batch.size());
        List<String> uris = new ArrayList<>(batch.size());
        for (TokenEntity t : batch) {
            ids.add(t.getTokenId());
            uris.add(t.metadataUri());
        }

        RevealTransactionEntity audit = revealTxRepo.save(RevealTransactionEntity.pending(ids));
        log.info("reveal.batch.submitting tokenCount={} tokenIds={}", ids.size(), ids);

        try {
            RevealHandle handle = chain.submitBatchReveal(ids, uris, props.getGasStrategy(), props.getGasBuffer());
            audit.setTxHash(handle.txHash());
            audit = revealTxRepo.save(audit);
            log.info("reveal.batch.submitted txHash={} nonce={} tokenIds={}", handle.txHash(), handle.nonce(), handle.tokenIds());

            ConfirmationResult result = chain.waitForConfirmation(handle, props.getTransactionTimeout());
            switch (result.outcome()) {
                case CONFIRMED -> commitRevealed(ids, audit, result);
                case REVERTED -> {
                    audit.setBlockNumber(result.blockNumber());
                    audit.setGasUsed(result.gasUsed());
                    audit.markFailed("Transaction reverted: " + handle.txHash());
                    revealTxRepo.save(audit);
                    releaseBatch(ids, "reverted");
                    // an earlier timed-out reveal may have landed since; settle it now
                    recoverPendingTransactions();
                }
                case TIMEOUT -> {
                    // may still confirm; left PENDING for the startup check
                    audit.setErrorMessage("Confirmation timeout after " + props.getTransactionTimeout());
                    revealTxRepo.save(audit);
                    releaseBatch(ids, "timeout");
                }
            }
        } catch (ServiceException e) {
            audit.markFailed(e.describe());
            revealTxRepo.save(audit);
            log.error("reveal.batch.submit_failed tokenCount={} code={} error={}", ids.size(), e.code(), e.getMessage());
            releaseBatch(ids, e.code());
        } catch (RuntimeException e) {
            releaseBatch(ids, "unexpected");
            throw e;
        }
    }

    /** claim up to max; a partial batch waits once for more, duplicates dropped */
    List<TokenEntity> accumulateBatch() {
        int max = props.getMaxBatchTokens();
        Map<Long, TokenEntity> byId = new LinkedHashMap<>();
        for (TokenEntity t : claimQueue.claim(TokenStatus.READY, max, owner)) byId.putIfAbsent(t.getTokenId(), t);

        if (byId.isEmpty() || byId.size() >= max) return new ArrayList<>(byId.values());

        log.debug("reveal.batch.waiting have={} max={} wait={}", byId.size(), max, props.getBatchWait());
        pause(props.getBatchWait());

        for (TokenEntity t : claimQueue.claim(TokenStatus.READY, max - byId.size(), owner)) {
            byId.putIfAbsent(t.getTokenId(), t);
        }
        return new ArrayList<>(byId.values());
    }

    private void commitRevealed(List<Long> ids, RevealTransactionEntity audit, ConfirmationResult result) {
        Instant now = clock.instant();
        try (WorkerTransaction tx = txs.begin()) {
            for (Long id : ids) {
                TokenEntity t = tokenRepo.findByTokenIdForUpdate(id)
                        .orElseThrow(() -> new IllegalStateException("TOKEN_VANISHED tokenId=" + id));
                if (t.getStatus() == TokenStatus.REVEALED) continue;
                t.markRevealed(result.txHash(), now);
                tokenRepo.save(t);
            }
            audit.markConfirmed(result.blockNumber(), result.gasUsed(), now);
            revealTxRepo.save(audit);
            tx.commit();
        }
        log.info("reveal.batch.confirmed txHash={} block={} gasUsed={} tokenCount={}",
                result.txHash(), result.blockNumber(), result.gasUsed(), ids.size());
    }

    private void releaseBatch(List<Long> ids, String reason) {
        claimQueue.release(ids);
        log.warn("reveal.batch.not_revealed reason={} tokenCount={} (tokens stay READY)", reason, ids.size());
    }

    /**
     * Settles audit rows left PENDING by an earlier run: confirmed receipts reveal their
     * tokens, reverted ones are marked failed, unknown ones stay pending. Rows that never got a
     * tx hash were not submitted and are marked failed.
     */
    public void recoverPendingTransactions() {
        List<RevealTransactionEntity> pending =
                revealTxRepo.findByTxStatusOrderByCreatedAtAsc(RevealTransactionEntity.TxStatus.PENDING);
        if (pending.isEmpty()) return;

        log.info("reveal.recovery.started pending={}", pending.size());
        for (RevealTransactionEntity audit : pending) {
            if (audit.getTxHash() == null || audit.getTxHash().isBlank()) {
                audit.markFailed("Never submitted (no tx hash)");
                revealTxRepo.save(audit);
                continue;
            }
            try {
                var receipt = chain.findReceipt(audit.getTxHash());
                if (receipt.isEmpty()) {
                    log.warn("reveal.recovery.still_pending txHash={}", audit.getTxHash());
                    continue;
                }
                ConfirmationResult r = receipt.get();
                if (r.isConfirmed()) {
                    commitRecovered(audit, r);
                } else {
                    audit.markFailed("Transaction reverted: " + audit.getTxHash());
                    revealTxRepo.save(audit);
                    log.warn("reveal.recovery.reverted txHash={}", audit.getTxHash());
                }
            } catch (ServiceException e) {
                log.warn("reveal.recovery.check_failed txHash={} code={} error={}",
                        audit.getTxHash(), e.code(), e.getMessage());
            }
        }
    }

    private void commitRecovered(RevealTransactionEntity audit, ConfirmationResult r) {
        Instant now = clock.instant();
        int revealed = 0;
        try (WorkerTransaction tx = txs.begin()) {
            for (Long id : audit.tokenIdList()) {
                TokenEntity t = tokenRepo.findByTokenIdForUpdate(id).orElse(null);
                if (t == null || t.getStatus() != TokenStatus.READY) continue;
                t.markRevealed(r.txHash(), now);
                tokenRepo.save(t);
                revealed++;
            }
            audit.markConfirmed(r.blockNumber(), r.gasUsed(), now);
            revealTxRepo.save(audit);
            tx.commit();
        }
        log.info("reveal.recovery.confirmed txHash={} revealed={}", r.txHash(), revealed);
    }

    private static void pause(Duration d) {
        if (d.isZero() || d.isNegative()) return;
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
