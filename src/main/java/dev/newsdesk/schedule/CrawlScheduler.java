package dev.newsdesk.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import dev.newsdesk.ledger.CrawlRun;
import dev.newsdesk.ledger.CrawlRunLedger;
import dev.newsdesk.run.CrawlDispatcher;
import dev.newsdesk.run.CrawlRunner;
import dev.newsdesk.source.Source;
import dev.newsdesk.source.SourceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Periodic crawl scheduling.
 *
 * <p>A tick loads the active sources, the set of sources with a running ledger entry and the
 * sources this process has dispatched but not yet finished, then dispatches a scheduled run for
 * every due source that is in neither set. Dispatch is
 * fire-and-forget. A failure on one source is logged and the tick moves on; the tick itself never
 * throws.
 */
@Service
public class CrawlScheduler {

    private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);

    private final SourceService sourceService;
    private final CrawlRunLedger ledger;
    private final CrawlDispatcher dispatcher;
    private final CrawlRunner crawlRunner;
    private final SchedulerProperties properties;
    private final Clock clock;

    public CrawlScheduler(SourceService sourceService,
                          CrawlRunLedger ledger,
                          CrawlDispatcher dispatcher,
                          CrawlRunner crawlRunner,
                          SchedulerProperties properties,
                          Clock clock) {
        this.sourceService = sourceService;
        this.ledger = ledger;
        this.dispatcher = dispatcher;
        this.crawlRunner = crawlRunner;
        this.properties = properties;
        this.clock = clock;
    }

    public TickSummary tick() {
        Instant now = clock.instant();
        List<Source> sources;
        Set<String> running;
        Set<String> pending;
        try {
            sources = sourceService.listActive();
            running = ledger.runningSourceNames();
            pending = dispatcher.pendingSourceNames();
        } catch (RuntimeException e) {
            log.error("Scheduler tick aborted, could not load sources or running crawls: {}",
                    e.getMessage(), e);
            return TickSummary.empty();
        }

        Set<String> dispatchedThisTick = new HashSet<>();
        List<String> triggered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Source source : sources) {
            String name = source.getName();
            try {
                if (running.contains(name)) {
                    log.debug("Source '{}' has a crawl in progress, skipping", name);
                    continue;
                }
                if (pending.contains(name)) {
                    log.debug("Source '{}' has a dispatched crawl waiting to start, skipping", name);
                    continue;
                }
                if (dispatchedThisTick.contains(name) || !DuePolicy.isDue(source, now)) {
                    continue;
                }
                logLateness(source, now);
                dispatcher.dispatch(name, source.getBaseUrl(), true);
                dispatchedThisTick.add(name);
                triggered.add(name);
            } catch (RuntimeException e) {
                log.warn("Could not schedule source '{}': {}", name, e.getMessage(), e);
                failed.add(name);
            }
        }

        TickSummary summary = new TickSummary(sources.size(), triggered, failed);
        if (triggered.isEmpty() && failed.isEmpty()) {
            log.debug("Scheduler tick: {} sources checked, none due", summary.checked());
        } else {
            log.info("Scheduler tick: {} sources checked, triggered {}{}", summary.checked(),
                    triggered, failed.isEmpty() ? "" : ", failed " + failed);
        }
        return summary;
    }

    /**
     * Refresh the heartbeat of every run this process is executing.
     *
     * @return number of running entries refreshed
     */
    public int heartbeatLiveRuns() {
        try {
            return ledger.heartbeat(crawlRunner.liveRunIds());
        } catch (RuntimeException e) {
            log.warn("Could not refresh crawl run heartbeats: {}", e.getMessage(), e);
            return 0;
        }
    }

    /**
     * Fail running ledger entries without a heartbeat for {@code stale-run-threshold-minutes}.
     * Runs this process is executing are refreshed first and never failed.
     *
     * @return number of runs failed
     */
    public int sweepStaleRuns() {
        Duration threshold = Duration.ofMinutes(properties.getStaleRunThresholdMinutes());
        try {
            Set<UUID> live = crawlRunner.liveRunIds();
            ledger.heartbeat(live);
            List<CrawlRun> failed = ledger.failStaleRuns(threshold, live);
            if (!failed.isEmpty()) {
                log.warn("Stale-run sweep failed {} crawl runs without a heartbeat for {} minutes",
                        failed.size(), threshold.toMinutes());
            }
            return failed.size();
        } catch (RuntimeException e) {
            log.error("Stale-run sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    private void logLateness(Source source, Instant now) {
        Duration late = DuePolicy.overdueBy(source, now);
        Duration interval = Duration.ofMinutes(source.getCrawlIntervalMinutes());
        if (late.compareTo(interval) >= 0) {
            log.info("Source '{}' is {} minutes overdue ({} missed intervals), running once",
                    source.getName(), late.toMinutes(), late.toMinutes() / interval.toMinutes());
        }
    }
}
