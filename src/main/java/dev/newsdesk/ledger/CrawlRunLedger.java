package dev.newsdesk.ledger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable lifecycle log of crawl runs, and the single source of truth for "is this source being
 * crawled right now".
 *
 * <p>A partial unique index allows at most one {@code RUNNING} entry per source, so
 * {@link #open} fails with {@link CrawlAlreadyRunningException} instead of creating a second one.
 * All timestamps come from the injected {@link Clock}.
 */
@Service
public class CrawlRunLedger {

    private static final Logger log = LoggerFactory.getLogger(CrawlRunLedger.class);

    static final int MAX_ERROR_MESSAGE_LENGTH = 4000;

    private final CrawlRunRepository crawlRunRepository;
    private final Clock clock;

    public CrawlRunLedger(CrawlRunRepository crawlRunRepository, Clock clock) {
        this.crawlRunRepository = crawlRunRepository;
        this.clock = clock;
    }

    /**
     * Create the {@code RUNNING} entry of a new run.
     *
     * @throws CrawlAlreadyRunningException if the source already has a running entry
     */
    public CrawlRun open(String sourceName, CrawlTrigger trigger) {
        try {
            CrawlRun run = crawlRunRepository.saveAndFlush(
                    new CrawlRun(sourceName, trigger, clock.instant()));
            log.debug("Opened crawl run {} for source '{}' ({})", run.getId(), sourceName, trigger);
            return run;
        } catch (DataIntegrityViolationException e) {
            throw new CrawlAlreadyRunningException(sourceName, e);
        }
    }

    @Transactional
    public CrawlRun complete(UUID runId, int found, int saved, int skipped, List<UUID> savedIds) {
        CrawlRun run = get(runId);
        run.markCompleted(clock.instant(), found, saved, skipped, savedIds);
        return crawlRunRepository.save(run);
    }

    /**
     * Move a run to {@code FAILED}, keeping the counts reached so far.
     */
    @Transactional
    public CrawlRun fail(UUID runId, @Nullable String errorMessage, int found, int saved,
                         int skipped, List<UUID> savedIds) {
        CrawlRun run = get(runId);
        run.markFailed(clock.instant(), truncate(errorMessage), found, saved, skipped, savedIds);
        return crawlRunRepository.save(run);
    }

    /**
     * @return names of sources with a run in {@code RUNNING} state
     */
    @Transactional(readOnly = true)
    public Set<String> runningSourceNames() {
        return new TreeSet<>(crawlRunRepository.findSourceNamesByStatus(CrawlRunStatus.RUNNING));
    }

    @Transactional(readOnly = true)
    public boolean isRunning(String sourceName) {
        return crawlRunRepository.existsBySourceNameAndStatus(sourceName, CrawlRunStatus.RUNNING);
    }

    @Transactional(readOnly = true)
    public List<CrawlRun> runningRuns() {
        return crawlRunRepository.findAllByStatusOrderByStartedAtAsc(CrawlRunStatus.RUNNING);
    }

    /**
     * Record that the given runs are still being executed by this process.
     *
     * @return number of running entries refreshed
     */
    @Transactional
    public int heartbeat(Collection<UUID> runIds) {
        if (runIds.isEmpty()) {
            return 0;
        }
        int updated = crawlRunRepository.updateHeartbeat(runIds, CrawlRunStatus.RUNNING,
                clock.instant());
        log.debug("Heartbeat refreshed {} of {} live crawl runs", updated, runIds.size());
        return updated;
    }

    /**
     * Fail every running entry whose last heartbeat is older than the threshold. Such runs belong
     * to workers that died without writing a terminal state.
     *
     * @param threshold  how long a run may go without a heartbeat
     * @param liveRunIds runs the calling process is executing right now; never failed
     * @return the runs that were failed
     */
    @Transactional
    public List<CrawlRun> failStaleRuns(Duration threshold, Set<UUID> liveRunIds) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(threshold);
        List<CrawlRun> stale = new ArrayList<>();
        for (CrawlRun run : crawlRunRepository.findAllByStatusAndLastHeartbeatAtBefore(
                CrawlRunStatus.RUNNING, cutoff)) {
            if (liveRunIds.contains(run.getId())) {
                continue;
            }
            run.markFailed(now, "No heartbeat for " + threshold.toMinutes()
                            + " minutes; marked failed by stale-run sweep",
                    run.getItemsFound(), run.getItemsSaved(), run.getItemsSkipped(), List.of());
            log.warn("Failed stale crawl run {} of source '{}' started at {}, last heartbeat {}",
                    run.getId(), run.getSourceName(), run.getStartedAt(),
                    run.getLastHeartbeatAt());
            stale.add(run);
        }
        return stale.isEmpty() ? List.of() : crawlRunRepository.saveAll(stale);
    }

    @Transactional(readOnly = true)
    public Optional<CrawlRun> find(UUID runId) {
        return crawlRunRepository.findById(runId);
    }

    /**
     * @throws CrawlRunNotFoundException if no run has this id
     */
    @Transactional(readOnly = true)
    public CrawlRun get(UUID runId) {
        return crawlRunRepository.findById(runId)
                .orElseThrow(() -> new CrawlRunNotFoundException(runId));
    }

    @Transactional(readOnly = true)
    public Page<CrawlRun> search(@Nullable String sourceName, @Nullable CrawlRunStatus status,
                                 Pageable pageable) {
        if (sourceName != null && status != null) {
            return crawlRunRepository.findAllBySourceNameAndStatus(sourceName, status, pageable);
        }
        if (sourceName != null) {
            return crawlRunRepository.findAllBySourceName(sourceName, pageable);
        }
        if (status != null) {
            return crawlRunRepository.findAllByStatus(status, pageable);
        }
        return crawlRunRepository.findAll(pageable);
    }

    private static String truncate(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Unknown error";
        }
        return message.length() <= MAX_ERROR_MESSAGE_LENGTH
                ? message : message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
