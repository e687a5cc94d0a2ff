package com.glisk.backend.token.repo;

import com.glisk.backend.token.entity.TokenEntity;
import com.glisk.backend.token.model.TokenStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TokenRepository extends JpaRepository<TokenEntity, String> {

    /**
     * MySQL 8 {@code FOR UPDATE SKIP LOCKED}: concurrent claimers skip rows another claimer
     * has locked instead of waiting for it. Must run inside a transaction.
     */
    @Query(
            value = """
            SELECT *
            FROM tokens
            WHERE status = :status
              AND (claimed_until IS NULL OR claimed_until < :now)
              AND (next_attempt_at IS NULL OR next_attempt_at <= :now)
            ORDER BY created_at ASC, token_id ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """,
            nativeQuery = true
    )
    List<TokenEntity> claimableForUpdate(@Param("status") String status,
                                         @Param("now") Instant now,
                                         @Param("limit") int limit);

    Optional<TokenEntity> findByTokenId(long tokenId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from TokenEntity t where t.tokenId = :tokenId")
    Optional<TokenEntity> findByTokenIdForUpdate(@Param("tokenId") long tokenId);

    long countByStatus(TokenStatus status);

    @Query("select t.tokenId from TokenEntity t where t.tokenId >= 0 and t.tokenId < :upper order by t.tokenId asc")
    List<Long> findTokenIdsBelow(@Param("upper") long upperExclusive);

    @Modifying
    @Query("""
            update TokenEntity t
               set t.claimedBy = null, t.claimedUntil = null
             where t.tokenId in :tokenIds
            """)
    int releaseClaims(@Param("tokenIds") Collection<Long> tokenIds);

    /** generating rows whose claim lapsed: the worker died mid-call */
    @Modifying
    @Query(
            value = """
            UPDATE tokens
            SET status = 'DETECTED',
                claimed_by = NULL,
                claimed_until = NULL,
                updated_at = :now
            WHERE status = 'GENERATING'
              AND (claimed_until IS NULL OR claimed_until < :now)
            """,
            nativeQuery = true
    )
    int resetOrphanedGenerating(@Param("now") Instant now);

    @Modifying
    @Query(
            value = """
            UPDATE tokens
            SET claimed_by = NULL,
                claimed_until = NULL
            WHERE claimed_until IS NOT NULL
              AND claimed_until < :now
              AND status <> 'GENERATING'
            """,
            nativeQuery = true
    )
    int clearExpiredClaims(@Param("now") Instant now);
}
