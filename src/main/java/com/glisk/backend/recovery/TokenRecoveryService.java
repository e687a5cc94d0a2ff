package com.glisk.backend.recovery;

import com.glisk.backend.common.error.DefaultAuthorNotFoundException;
import com.glisk.backend.recovery.config.RecoveryProperties;
import com.glisk.backend.reveal.chain.BlockchainClient;
import com.glisk.backend.token.entity.AuthorEntity;
import com.glisk.backend.token.repo.AuthorRepository;
import com.glisk.backend.token.repo.TokenInsertDao;
import com.glisk.backend.token.repo.TokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Backfills token rows the detector never wrote, by diffing the contract's nextTokenId counter
 * against the store.
 * <p>
 * All inserts run in one transaction. A duplicate token_id (a live detector insert racing us)
 * rolls back to a savepoint and is counted as skipped; any other failure rolls back everything.
 * A dry run does the same work and always rolls back.
 * <p>
 * The inserts are plain JDBC, so they run under a JDBC transaction manager of their own;
 * the JPA reads happen before it opens.
 */
@Slf4j
@Service
public class TokenRecoveryService {

    private final BlockchainClient chain;
    private final TokenRepository tokenRepo;
    private final AuthorRepository authorRepo;
    private final TokenInsertDao insertDao;
    private final RecoveryProperties props;
    private final TransactionTemplate txTemplate;
    private final Clock clock;

    @Autowired
    public TokenRecoveryService(BlockchainClient chain,
                                TokenRepository tokenRepo,
                                AuthorRepository authorRepo,
                                TokenInsertDao insertDao,
                                RecoveryProperties props,
                                DataSource dataSource,
                                Clock clock) {
        this(chain, tokenRepo, authorRepo, insertDao, props, new DataSourceTransactionManager(dataSource), clock);
    }

    TokenRecoveryService(BlockchainClient chain,
                         TokenRepository tokenRepo,
                         AuthorRepository authorRepo,
                         TokenInsertDao insertDao,
                         RecoveryProperties props,
                         PlatformTransactionManager txManager,
                         Clock clock) {
        this.chain = chain;
        this.tokenRepo = tokenRepo;
        this.authorRepo = authorRepo;
        this.insertDao = insertDao;
        this.props = props;
        this.txTemplate = new TransactionTemplate(txManager);
        this.clock = clock;
    }

    /**
     * @param limit  max ids to insert; null means the configured batch size
     * @throws com.glisk.backend.common.error.BlockchainConnectionException counter unreadable after retries
     * @throws DefaultAuthorNotFoundException default author row missing
     */
    public RecoveryResult reconcile(Integer limit, boolean dryRun) {
        long t0 = System.nanoTime();
        long counter = chain.readNextTokenId();
        int cap = limit != null ? limit : props.getBatchSize();
        if (cap <= 0) throw new IllegalArgumentException("limit must be positive");

        log.info("recovery.started nextTokenId={} limit={} dryRun={}", counter, cap, dryRun);

        AuthorEntity defaultAuthor = defaultAuthor();

        List<Long> gaps = missingIds(counter);
        if (gaps.isEmpty()) {
            log.info("recovery.no_gaps nextTokenId={}", counter);
            return RecoveryResult.noGaps(counter, dryRun);
        }

        List<Long> todo = gaps.size() > cap ? gaps.subList(0, cap) : gaps;
        log.info("recovery.gaps_detected missing={} attempting={} first={} last={}",
                gaps.size(), todo.size(), todo.get(0), todo.get(todo.size() - 1));

        RecoveryResult result = txTemplate.execute(status -> {
            Instant now = clock.instant();
            int recovered = 0;
            int skipped = 0;
            List<String> errors = new ArrayList<>();

            for (Long id : todo) {
                if (insertOne(status, id, defaultAuthor.getId(), now)) {
                    recovered++;
                } else {
                    skipped++;
                }
            }

            if (dryRun) status.setRollbackOnly();

            int remaining = gaps.size() - todo.size();
            if (remaining > 0) {
                errors.add(remaining + " missing tokens left for a later run (limit " + cap + ")");
            }
            return new RecoveryResult(counter, todo.size(), recovered, skipped, remaining, dryRun, errors);
        });

        log.info("recovery.finished nextTokenId={} missing={} recovered={} skippedDuplicates={} dryRun={} tookMs={}",
                result.onChainCount(), result.missingCount(), result.recoveredCount(),
                result.skippedDuplicates(), dryRun, (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    /** ascending ids in [0, counter) with no row */
    List<Long> missingIds(long counter) {
        if (counter <= 0) return List.of();
        Set<Long> present = new HashSet<>(tokenRepo.findTokenIdsBelow(counter));
        List<Long> missing = new ArrayList<>();
        for (long id = 0; id < counter; id++) {
            if (!present.contains(id)) missing.add(id);
        }
        return missing;
    }

    private boolean insertOne(TransactionStatus status, long tokenId, String authorId, Instant now) {
        Object savepoint = status.createSavepoint();
        try {
            insertDao.insertDetected(tokenId, authorId, now);
            status.releaseSavepoint(savepoint);
            log.debug("recovery.token_created tokenId={}", tokenId);
            return true;
        } catch (DuplicateKeyException e) {
            status.rollbackToSavepoint(savepoint);
            log.info("recovery.duplicate_skipped tokenId={}", tokenId);
            return false;
        }
    }

    private AuthorEntity defaultAuthor() {
        String wallet = props.getDefaultAuthorWallet();
        try {
            return authorRepo.findByWallet(wallet).orElseThrow(() -> new DefaultAuthorNotFoundException(wallet));
        } catch (IllegalArgumentException e) {
            throw new DefaultAuthorNotFoundException(wallet);
        }
    }
}
