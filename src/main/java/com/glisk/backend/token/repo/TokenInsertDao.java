package com.glisk.backend.token.repo;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * Plain JDBC insert for reconciliation. A duplicate {@code token_id} surfaces as
 * {@link org.springframework.dao.DuplicateKeyException} without poisoning a JPA session.
 */
@RequiredArgsConstructor
@Repository
public class TokenInsertDao {

    private final JdbcTemplate jdbc;

    public void insertDetected(long tokenId, String authorId, Instant now) {
        Timestamp ts = Timestamp.from(now);
        jdbc.update("""
                INSERT INTO tokens
                    (id, token_id, author_id, status, generation_attempts, upload_attempts, created_at, updated_at)
                VALUES (?, ?, ?, 'DETECTED', 0, 0, ?, ?)
                """,
                UUID.randomUUID().toString(), tokenId, authorId, ts, ts);
    }
}
