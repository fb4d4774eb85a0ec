package dev.newsdesk.api;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import dev.newsdesk.ledger.CrawlRun;
import dev.newsdesk.ledger.CrawlRunStatus;
import dev.newsdesk.ledger.CrawlTrigger;
import org.jspecify.annotations.Nullable;

public record CrawlRunView(
        UUID id,
        String sourceName,
        CrawlTrigger trigger,
        CrawlRunStatus status,
        Instant startedAt,
        @Nullable Instant endedAt,
        int itemsFound,
        int itemsSaved,
        int itemsSkipped,
        List<String> savedItemIds,
        @Nullable String errorMessage,
        @Nullable Long durationMs
) {

    static CrawlRunView from(CrawlRun run) {
        return new CrawlRunView(run.getId(), run.getSourceName(), run.getTrigger(),
                run.getStatus(), run.getStartedAt(), run.getEndedAt(), run.getItemsFound(),
                run.getItemsSaved(), run.getItemsSkipped(), run.getSavedItemIds(),
                run.getErrorMessage(), run.getDurationMs());
    }
}
