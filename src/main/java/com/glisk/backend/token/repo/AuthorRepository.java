package com.glisk.backend.token.repo;

import com.glisk.backend.token.entity.AuthorEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AuthorRepository extends JpaRepository<AuthorEntity, String> {

    Optional<AuthorEntity> findByWalletAddress(String walletAddress);

    /** wallet is normalized to checksum form before lookup */
    default Optional<AuthorEntity> findByWallet(String wallet) {
        if (wallet == null || wallet.isBlank()) return Optional.empty();
        return findByWalletAddress(AuthorEntity.normalizeWallet(wallet));
    }
}
