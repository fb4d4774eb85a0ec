package dev.newsdesk.schedule;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the ledger entries of runs executing in this process alive, so a stale-run sweep in any
 * process leaves them alone. Runs whether or not the scheduler is enabled, since manual crawls
 * need it too.
 */
@Component
public class LiveRunHeartbeat {

    private final CrawlScheduler crawlScheduler;

    public LiveRunHeartbeat(CrawlScheduler crawlScheduler) {
        this.crawlScheduler = crawlScheduler;
    }

    @Scheduled(fixedDelayString = "#{@schedulerProperties.heartbeatIntervalMs}",
            initialDelayString = "#{@schedulerProperties.heartbeatIntervalMs}")
    public void heartbeat() {
        crawlScheduler.heartbeatLiveRuns();
    }
}
