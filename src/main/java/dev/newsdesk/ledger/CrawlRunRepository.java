package dev.newsdesk.ledger;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CrawlRunRepository extends JpaRepository<CrawlRun, UUID> {

    @Query("SELECT DISTINCT r.sourceName FROM CrawlRun r WHERE r.status = :status")
    List<String> findSourceNamesByStatus(@Param("status") CrawlRunStatus status);

    boolean existsBySourceNameAndStatus(String sourceName, CrawlRunStatus status);

    List<CrawlRun> findAllByStatusOrderByStartedAtAsc(CrawlRunStatus status);

    List<CrawlRun> findAllByStatusAndLastHeartbeatAtBefore(CrawlRunStatus status, Instant cutoff);

    @Modifying
    @Query("UPDATE CrawlRun r SET r.lastHeartbeatAt = :now "
            + "WHERE r.id IN :ids AND r.status = :status")
    int updateHeartbeat(@Param("ids") Collection<UUID> ids, @Param("status") CrawlRunStatus status,
                        @Param("now") Instant now);

    Page<CrawlRun> findAllBySourceName(String sourceName, Pageable pageable);

    Page<CrawlRun> findAllByStatus(CrawlRunStatus status, Pageable pageable);

    Page<CrawlRun> findAllBySourceNameAndStatus(String sourceName, CrawlRunStatus status,
                                                Pageable pageable);
}
