package com.glisk.backend.token.service;

import com.glisk.backend.token.entity.TokenEntity;
import com.glisk.backend.token.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.NoSuchElementException;

/** Operator actions on single tokens. */
@Slf4j
@RequiredArgsConstructor
@Service
public class TokenAdminService {

    private final TokenRepository tokenRepo;
    private final Clock clock;

    /**
     * failed -> detected with counters, error, lease and backoff cleared.
     * Any other status throws {@link com.glisk.backend.token.model.InvalidStateTransitionException}.
     */
    @Transactional
    public TokenEntity resetFailed(long tokenId) {
        TokenEntity t = tokenRepo.findByTokenIdForUpdate(tokenId)
                .orElseThrow(() -> new NoSuchElementException("TOKEN_NOT_FOUND tokenId=" + tokenId));

        String previousError = t.getGenerationError();
        t.resetForRetry(clock.instant());
        tokenRepo.save(t);

        log.info("token.reset tokenId={} previousError={}", tokenId, previousError);
        return t;
    }
}
