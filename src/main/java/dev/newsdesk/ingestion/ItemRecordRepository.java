package dev.newsdesk.ingestion;

import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ItemRecordRepository extends JpaRepository<ItemRecord, UUID> {

    boolean existsByContentHash(String contentHash);

    Page<ItemRecord> findAllBySourceName(String sourceName, Pageable pageable);

    long countBySourceName(String sourceName);

    long countByProcessedTrue();

    long countBySourceNameAndProcessedTrue(String sourceName);
}
