package com.glisk.backend.token.repo;

import com.glisk.backend.token.entity.IpfsUploadRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IpfsUploadRecordRepository extends JpaRepository<IpfsUploadRecordEntity, String> {

    List<IpfsUploadRecordEntity> findByTokenIdOrderByCreatedAtAsc(long tokenId);
}
