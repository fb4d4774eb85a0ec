package dev.newsdesk.api;

import java.time.Instant;
import java.util.UUID;

import dev.newsdesk.crawl.CrawlProgress;
import dev.newsdesk.ledger.CrawlRun;
import dev.newsdesk.ledger.CrawlTrigger;
import org.jspecify.annotations.Nullable;

/**
 * A running ledger entry, with the in-memory progress of this process when it has any.
 *
 * @param progress live counters, or {@code null} when the run is not executing in this process
 */
public record ActiveCrawlView(
        UUID runId,
        String sourceName,
        CrawlTrigger trigger,
        Instant startedAt,
        @Nullable CrawlProgress progress
) {

    static ActiveCrawlView from(CrawlRun run, @Nullable CrawlProgress progress) {
        CrawlProgress matching = progress != null && progress.runId().equals(run.getId())
                ? progress : null;
        return new ActiveCrawlView(run.getId(), run.getSourceName(), run.getTrigger(),
                run.getStartedAt(), matching);
    }
}
