package com.glisk.backend.token.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "authors",
        uniqueConstraints = @UniqueConstraint(name = "ux_authors_wallet", columnNames = "wallet_address"))
public class AuthorEntity {

    public static final int MAX_PROMPT_LENGTH = 1000;

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    /** EIP-55 checksum form */
    @Column(name = "wallet_address", length = 42, nullable = false)
    private String walletAddress;

    @Column(name = "prompt_text", columnDefinition = "TEXT")
    private String promptText;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static AuthorEntity of(String walletAddress, String promptText) {
        AuthorEntity a = new AuthorEntity();
        a.setWalletAddress(normalizeWallet(walletAddress));
        a.setPromptText(promptText);
        return a;
    }

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = Instant.now();
        walletAddress = normalizeWallet(walletAddress);
    }

    public boolean hasPrompt() {
        return promptText != null && !promptText.isBlank();
    }

    /**
     * Accepts any-case 0x-prefixed address and returns its checksum form.
     */
    public static String normalizeWallet(String wallet) {
        if (wallet == null || !wallet.startsWith("0x") || !WalletUtils.isValidAddress(wallet)) {
            throw new IllegalArgumentException("Wallet address must be 0x followed by 40 hex characters");
        }
        return Keys.toChecksumAddress(wallet);
    }
}
