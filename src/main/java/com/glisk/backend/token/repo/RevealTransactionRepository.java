package com.glisk.backend.token.repo;

import com.glisk.backend.token.entity.RevealTransactionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RevealTransactionRepository extends JpaRepository<RevealTransactionEntity, String> {

    List<RevealTransactionEntity> findByTxStatusOrderByCreatedAtAsc(RevealTransactionEntity.TxStatus txStatus);
}
