package com.glisk.backend.token.entity;

import com.glisk.backend.token.model.InvalidStateTransitionException;
import com.glisk.backend.token.model.TokenStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "tokens",
        uniqueConstraints = @UniqueConstraint(name = "ux_tokens_token_id", columnNames = "token_id"),
        indexes = {
                @Index(name = "idx_tokens_status_claim", columnList = "status,claimed_until,next_attempt_at"),
                @Index(name = "idx_tokens_author", columnList = "author_id")
        }
)
public class TokenEntity {

    public static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "token_id", nullable = false, updatable = false)
    private long tokenId;

    @Column(name = "author_id", length = 36, nullable = false, updatable = false)
    private String authorId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private TokenStatus status;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Column(name = "image_cid", length = 255)
    private String imageCid;

    @Column(name = "metadata_cid", length = 255)
    private String metadataCid;

    @Column(name = "generation_attempts", nullable = false)
    private int generationAttempts = 0;

    @Column(name = "upload_attempts", nullable = false)
    private int uploadAttempts = 0;

    @Column(name = "generation_error", length = MAX_ERROR_LENGTH)
    private String generationError;

    @Column(name = "reveal_tx_hash", length = 66)
    private String revealTxHash;

    /** worker instance currently holding the claim */
    @Column(name = "claimed_by", length = 64)
    private String claimedBy;

    @Column(name = "claimed_until")
    private Instant claimedUntil;

    /** not claimable before this instant (retry backoff) */
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static TokenEntity detected(long tokenId, String authorId) {
        TokenEntity t = new TokenEntity();
        t.setTokenId(tokenId);
        t.setAuthorId(authorId);
        t.setStatus(TokenStatus.DETECTED);
        return t;
    }

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (status == null) status = TokenStatus.DETECTED;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    // ===== claim =====

    public void claim(String owner, Instant until) {
        this.claimedBy = owner;
        this.claimedUntil = until;
    }

    public void releaseClaim() {
        this.claimedBy = null;
        this.claimedUntil = null;
    }

    // ===== generation stage =====

    public void markGenerating(Instant now) {
        moveTo(TokenStatus.GENERATING, now);
        this.generationAttempts += 1;
    }

    /**
     * Attempts already used up (a worker died during the last one and the reaper returned the
     * token): goes straight to FAILED through GENERATING without counting another attempt.
     */
    public void failGenerationExhausted(String error, Instant now) {
        moveTo(TokenStatus.GENERATING, now);
        markFailed(error, now);
    }

    public void markUploading(String imageUrl, Instant now) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new IllegalArgumentException("image_url cannot be empty");
        }
        moveTo(TokenStatus.UPLOADING, now);
        this.imageUrl = imageUrl;
        this.generationError = null;
        this.nextAttemptAt = null;
        releaseClaim();
    }

    /** Transient generation failure: back to DETECTED, claimable again after {@code retryAt}. */
    public void scheduleGenerationRetry(Instant retryAt, Instant now) {
        moveTo(TokenStatus.DETECTED, now);
        this.nextAttemptAt = retryAt;
        releaseClaim();
    }

    // ===== upload stage =====

    public void markUploadAttempt(Instant now) {
        requireStatus(TokenStatus.UPLOADING);
        this.uploadAttempts += 1;
        this.updatedAt = now;
    }

    public void scheduleUploadRetry(Instant retryAt, Instant now) {
        requireStatus(TokenStatus.UPLOADING);
        this.nextAttemptAt = retryAt;
        this.updatedAt = now;
        releaseClaim();
    }

    public void markReady(String imageCid, String metadataCid, Instant now) {
        if (isBlank(imageCid) || isBlank(metadataCid)) {
            throw new IllegalArgumentException("Both image_cid and metadata_cid are required");
        }
        moveTo(TokenStatus.READY, now);
        this.imageCid = imageCid;
        this.metadataCid = metadataCid;
        this.nextAttemptAt = null;
        releaseClaim();
    }

    // ===== reveal stage =====

    public void markRevealed(String txHash, Instant now) {
        if (isBlank(txHash)) throw new IllegalArgumentException("tx_hash is required");
        moveTo(TokenStatus.REVEALED, now);
        if (this.revealTxHash == null) this.revealTxHash = txHash;
        releaseClaim();
    }

    public String metadataUri() {
        return "ipfs://" + metadataCid;
    }

    // ===== terminal / operator =====

    public void markFailed(String error, Instant now) {
        moveTo(TokenStatus.FAILED, now);
        this.generationError = truncate(error);
        this.nextAttemptAt = null;
        releaseClaim();
    }

    public void resetForRetry(Instant now) {
        moveTo(TokenStatus.DETECTED, now);
        this.generationAttempts = 0;
        this.uploadAttempts = 0;
        this.generationError = null;
        this.nextAttemptAt = null;
        releaseClaim();
    }

    private void moveTo(TokenStatus next, Instant now) {
        if (status == null || !status.canMoveTo(next)) {
            throw new InvalidStateTransitionException(tokenId, status, next);
        }
        this.status = next;
        this.updatedAt = now;
    }

    private void requireStatus(TokenStatus expected) {
        if (status != expected) {
            throw new InvalidStateTransitionException(tokenId, status, expected);
        }
    }

    static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= MAX_ERROR_LENGTH ? s : s.substring(0, MAX_ERROR_LENGTH);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
