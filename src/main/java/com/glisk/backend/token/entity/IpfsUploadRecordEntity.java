package com.glisk.backend.token.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "ipfs_upload_records",
        indexes = @Index(name = "idx_ipfs_records_token", columnList = "token_id"))
public class IpfsUploadRecordEntity {

    public enum RecordType { IMAGE, METADATA }

    public enum RecordStatus { COMPLETED, FAILED }

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "token_id", nullable = false)
    private long tokenId;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", length = 16, nullable = false)
    private RecordType recordType;

    @Column(length = 255)
    private String cid;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_status", length = 16, nullable = false)
    private RecordStatus recordStatus;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static IpfsUploadRecordEntity completed(long tokenId, RecordType type, String cid, int retryCount) {
        IpfsUploadRecordEntity r = new IpfsUploadRecordEntity();
        r.setTokenId(tokenId);
        r.setRecordType(type);
        r.setCid(cid);
        r.setRecordStatus(RecordStatus.COMPLETED);
        r.setRetryCount(retryCount);
        return r;
    }

    public static IpfsUploadRecordEntity failed(long tokenId, RecordType type, String error, int retryCount) {
        IpfsUploadRecordEntity r = new IpfsUploadRecordEntity();
        r.setTokenId(tokenId);
        r.setRecordType(type);
        r.setRecordStatus(RecordStatus.FAILED);
        r.setErrorMessage(TokenEntity.truncate(error));
        r.setRetryCount(retryCount);
        return r;
    }

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = Instant.now();
    }
}
