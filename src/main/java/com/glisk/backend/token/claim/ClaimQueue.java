package com.glisk.backend.token.claim;

import com.glisk.backend.pipeline.config.PipelineProperties;
import com.glisk.backend.token.entity.TokenEntity;
import com.glisk.backend.token.model.TokenStatus;
import com.glisk.backend.token.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Atomic batch reservation over the token table.
 * <p>
 * The claim runs in its own short transaction: rows are picked with {@code FOR UPDATE SKIP LOCKED}
 * (a concurrent claimer skips them instead of waiting), stamped with {@code claimed_by} and a lease,
 * and committed. If that commit never happens nothing is claimed; if the worker dies afterwards the
 * lease runs out and the rows become claimable again.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ClaimQueue {

    private final TokenRepository tokenRepo;
    private final PipelineProperties pipelineProps;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<TokenEntity> claim(TokenStatus status, int limit, String owner) {
        if (limit <= 0) return List.of();

        Instant now = clock.instant();
        List<TokenEntity> rows = tokenRepo.claimableForUpdate(status.name(), now, limit);
        if (rows.isEmpty()) return rows;

        Instant until = now.plus(pipelineProps.getClaimLease());
        for (TokenEntity t : rows) {
            t.claim(owner, until);
        }
        tokenRepo.saveAll(rows);

        log.debug("claim.ok status={} owner={} count={}", status, owner, rows.size());
        return rows;
    }

    /** drops the lease, status untouched */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int release(Collection<Long> tokenIds) {
        if (tokenIds == null || tokenIds.isEmpty()) return 0;
        return tokenRepo.releaseClaims(tokenIds);
    }
}
