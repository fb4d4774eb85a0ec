package dev.newsdesk.run;

import java.time.Clock;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import dev.newsdesk.ledger.CrawlAlreadyRunningException;
import dev.newsdesk.ledger.CrawlTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs each dispatched crawl on the bounded {@code crawlRunExecutor} pool, so a slow crawl never
 * holds up the scheduler thread or an HTTP request.
 *
 * <p>A source counts as pending from the moment it is handed to the pool until its run returns,
 * which covers the time spent queued before the run opens its ledger entry.
 */
@Component
public class ExecutorCrawlDispatcher implements CrawlDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutorCrawlDispatcher.class);

    private final CrawlRunner crawlRunner;
    private final Executor crawlRunExecutor;
    private final Clock clock;
    private final ConcurrentHashMap<String, Integer> pending = new ConcurrentHashMap<>();

    public ExecutorCrawlDispatcher(CrawlRunner crawlRunner,
                                   @Qualifier("crawlRunExecutor") Executor crawlRunExecutor,
                                   Clock clock) {
        this.crawlRunner = crawlRunner;
        this.crawlRunExecutor = crawlRunExecutor;
        this.clock = clock;
    }

    @Override
    public DispatchHandle dispatch(String sourceName, String baseUrl, boolean scheduled) {
        CrawlTrigger trigger = CrawlTrigger.of(scheduled);
        UUID dispatchId = UUID.randomUUID();
        CompletableFuture<CrawlRunOutcome> outcome;
        pending.merge(sourceName, 1, Integer::sum);
        try {
            outcome = CompletableFuture.supplyAsync(
                    () -> crawlRunner.run(sourceName, baseUrl, trigger), crawlRunExecutor);
        } catch (RejectedExecutionException e) {
            release(sourceName);
            throw new DispatchRejectedException(sourceName, e);
        }
        outcome.whenComplete((result, error) -> {
            release(sourceName);
            if (error == null) {
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof CrawlAlreadyRunningException) {
                log.info("Dispatch {} dropped: {}", dispatchId, cause.getMessage());
            } else {
                log.error("Dispatch {} of source '{}' did not run: {}", dispatchId, sourceName,
                        cause.getMessage(), cause);
            }
        });
        log.debug("Dispatched crawl of '{}' ({}) as {}", sourceName, trigger, dispatchId);
        return new DispatchHandle(dispatchId, sourceName, trigger, clock.instant(), outcome);
    }

    @Override
    public Set<String> pendingSourceNames() {
        return Set.copyOf(pending.keySet());
    }

    private void release(String sourceName) {
        pending.computeIfPresent(sourceName, (name, count) -> count > 1 ? count - 1 : null);
    }
}
