package dev.newsdesk.run;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import dev.newsdesk.ledger.CrawlTrigger;

/**
 * Returned by {@link CrawlDispatcher#dispatch} before the run starts.
 *
 * @param dispatchId   identifies this dispatch in logs
 * @param sourceName   the source to crawl
 * @param trigger      scheduler or manual
 * @param dispatchedAt when the run was handed over
 * @param outcome      completes with the run's outcome, or exceptionally if it never started
 */
public record DispatchHandle(
        UUID dispatchId,
        String sourceName,
        CrawlTrigger trigger,
        Instant dispatchedAt,
        CompletableFuture<CrawlRunOutcome> outcome
) {
}
