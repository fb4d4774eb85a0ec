package dev.newsdesk.schedule;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Timer entry points for the scheduler tick and the stale-run sweep. Delays come from
 * {@link SchedulerProperties}. Not created when {@code newsdesk.scheduler.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "newsdesk.scheduler.enabled", havingValue = "true",
        matchIfMissing = true)
public class ScheduledCrawlJobs {

    private final CrawlScheduler crawlScheduler;

    public ScheduledCrawlJobs(CrawlScheduler crawlScheduler) {
        this.crawlScheduler = crawlScheduler;
    }

    @Scheduled(fixedDelayString = "#{@schedulerProperties.tickIntervalMs}",
            initialDelayString = "#{@schedulerProperties.initialDelayMs}")
    public void tick() {
        crawlScheduler.tick();
    }

    @Scheduled(fixedDelayString = "#{@schedulerProperties.staleSweepIntervalMs}",
            initialDelayString = "#{@schedulerProperties.initialDelayMs}")
    public void sweepStaleRuns() {
        crawlScheduler.sweepStaleRuns();
    }
}
