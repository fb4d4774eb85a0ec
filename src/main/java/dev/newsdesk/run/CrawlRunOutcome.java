package dev.newsdesk.run;

import java.util.UUID;

import dev.newsdesk.ledger.CrawlRunStatus;
import dev.newsdesk.ledger.CrawlTrigger;
import org.jspecify.annotations.Nullable;

/**
 * What a finished crawl run wrote to the ledger.
 *
 * @param runId        the ledger entry
 * @param sourceName   the crawled source
 * @param trigger      scheduler or manual
 * @param status       terminal status, or {@code RUNNING} if the terminal write itself failed
 * @param itemsFound   parsed items returned by the orchestrator
 * @param itemsSaved   new items stored
 * @param itemsSkipped items already known
 * @param errorMessage why the run failed, if it did
 */
public record CrawlRunOutcome(
        UUID runId,
        String sourceName,
        CrawlTrigger trigger,
        CrawlRunStatus status,
        int itemsFound,
        int itemsSaved,
        int itemsSkipped,
        @Nullable String errorMessage
) {
}
