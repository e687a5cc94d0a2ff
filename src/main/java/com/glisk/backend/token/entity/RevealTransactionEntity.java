package com.glisk.backend.token.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Getter
@Setter
@Entity
@Table(name = "reveal_transactions",
        indexes = {
                @Index(name = "idx_reveal_tx_status", columnList = "tx_status"),
                @Index(name = "idx_reveal_tx_hash", columnList = "tx_hash")
        }
)
public class RevealTransactionEntity {

    public enum TxStatus { PENDING, CONFIRMED, FAILED }

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    /** comma separated on-chain token ids */
    @Column(name = "token_ids", columnDefinition = "TEXT", nullable = false)
    private String tokenIds;

    @Column(name = "tx_hash", length = 66)
    private String txHash;

    @Column(name = "block_number")
    private Long blockNumber;

    @Column(name = "gas_used")
    private Long gasUsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "tx_status", length = 16, nullable = false)
    private TxStatus txStatus;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    public static RevealTransactionEntity pending(List<Long> tokenIds) {
        RevealTransactionEntity e = new RevealTransactionEntity();
        e.setTokenIds(tokenIds.stream().map(String::valueOf).collect(Collectors.joining(",")));
        e.setTxStatus(TxStatus.PENDING);
        return e;
    }

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = Instant.now();
        if (txStatus == null) txStatus = TxStatus.PENDING;
    }

    public List<Long> tokenIdList() {
        if (tokenIds == null || tokenIds.isBlank()) return List.of();
        return Arrays.stream(tokenIds.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Long::valueOf)
                .toList();
    }

    public void markConfirmed(long blockNumber, long gasUsed, Instant now) {
        this.txStatus = TxStatus.CONFIRMED;
        this.blockNumber = blockNumber;
        this.gasUsed = gasUsed;
        this.confirmedAt = now;
        this.errorMessage = null;
    }

    public void markFailed(String error) {
        this.txStatus = TxStatus.FAILED;
        this.errorMessage = TokenEntity.truncate(error);
    }
}
