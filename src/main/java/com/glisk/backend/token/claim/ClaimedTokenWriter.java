package com.glisk.backend.token.claim;

import com.glisk.backend.pipeline.tx.WorkerTransaction;
import com.glisk.backend.pipeline.tx.WorkerTransactions;
import com.glisk.backend.token.entity.TokenEntity;
import com.glisk.backend.token.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * One decision point of a worker iteration: reload the token under a row lock in a fresh
 * transaction, check the caller still owns the claim, apply the change and commit.
 * <p>
 * A token whose claim was lost (lease expired and reaped, or re-claimed) is left untouched.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ClaimedTokenWriter {

    private final WorkerTransactions txs;
    private final TokenRepository tokenRepo;

    /** @return the token after the committed change, empty when the claim is gone */
    public Optional<TokenEntity> update(long tokenId, String owner, Consumer<TokenEntity> change) {
        try (WorkerTransaction tx = txs.begin()) {
            TokenEntity t = tokenRepo.findByTokenIdForUpdate(tokenId).orElse(null);
            if (t == null || !owner.equals(t.getClaimedBy())) {
                log.warn("claim.lost tokenId={} owner={} holder={}",
                        tokenId, owner, t == null ? null : t.getClaimedBy());
                tx.rollback();
                return Optional.empty();
            }

            change.accept(t);
            tokenRepo.save(t);
            tx.commit();
            return Optional.of(t);
        }
    }
}
