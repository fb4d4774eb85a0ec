package dev.newsdesk.run;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import dev.newsdesk.adapter.CrawlTarget;
import dev.newsdesk.adapter.SourceAdapter;
import dev.newsdesk.adapter.SourceAdapterRegistry;
import dev.newsdesk.crawl.CrawlOrchestrator;
import dev.newsdesk.crawl.CrawlProgress;
import dev.newsdesk.crawl.CrawlProgressTracker;
import dev.newsdesk.crawl.CrawledItem;
import dev.newsdesk.ingestion.CommitResult;
import dev.newsdesk.ingestion.IngestionTally;
import dev.newsdesk.ingestion.ItemIngestionService;
import dev.newsdesk.ledger.CrawlAlreadyRunningException;
import dev.newsdesk.ledger.CrawlRun;
import dev.newsdesk.ledger.CrawlRunLedger;
import dev.newsdesk.ledger.CrawlRunStatus;
import dev.newsdesk.ledger.CrawlTrigger;
import dev.newsdesk.source.Source;
import dev.newsdesk.source.SourceService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One end-to-end crawl run of one source.
 *
 * <p>The ledger entry is opened before anything else. Every error after that point is caught
 * here and turned into a {@code FAILED} terminal write carrying the counts reached so far; items
 * already stored stay stored. A JVM {@link Error} is recorded the same way and then rethrown. Whatever the outcome, the source's crawl markers are advanced once
 * the run has finished.
 *
 * <p>The runner does not know which thread it runs on; {@link CrawlDispatcher} decides that.
 */
@Service
public class CrawlRunner {

    private static final Logger log = LoggerFactory.getLogger(CrawlRunner.class);

    private final CrawlRunLedger ledger;
    private final SourceService sourceService;
    private final SourceAdapterRegistry adapterRegistry;
    private final CrawlOrchestrator orchestrator;
    private final ItemIngestionService ingestionService;
    private final CrawlProgressTracker progressTracker;

    public CrawlRunner(CrawlRunLedger ledger,
                       SourceService sourceService,
                       SourceAdapterRegistry adapterRegistry,
                       CrawlOrchestrator orchestrator,
                       ItemIngestionService ingestionService,
                       CrawlProgressTracker progressTracker) {
        this.ledger = ledger;
        this.sourceService = sourceService;
        this.adapterRegistry = adapterRegistry;
        this.orchestrator = orchestrator;
        this.ingestionService = ingestionService;
        this.progressTracker = progressTracker;
    }

    /**
     * Crawl one source and record the run.
     *
     * @param sourceName the source to crawl
     * @param baseUrl    base address to crawl from; {@code null} uses the configured one
     * @param trigger    what started the run
     * @return what was written to the ledger
     * @throws CrawlAlreadyRunningException if the source already has a running entry; nothing is
     *                                      crawled and no markers move
     */
    public CrawlRunOutcome run(String sourceName, @Nullable String baseUrl, CrawlTrigger trigger) {
        CrawlRun run = ledger.open(sourceName, trigger);
        UUID runId = run.getId();
        progressTracker.start(sourceName, runId);
        log.info("Crawl run {} of source '{}' started ({})", runId, sourceName, trigger);

        IngestionTally tally = new IngestionTally();
        int found = 0;
        try {
            Source source = sourceService.getByName(sourceName);
            CrawlTarget target = new CrawlTarget(source.getName(),
                    baseUrl != null && !baseUrl.isBlank() ? baseUrl : source.getBaseUrl(),
                    source.getSettings());
            SourceAdapter adapter = adapterRegistry.resolve(target);

            List<CrawledItem> items = orchestrator.crawl(target, adapter);
            found = items.size();

            progressTracker.recordCommitting(sourceName);
            ingestionService.commit(items, tally);
            CommitResult result = tally.toResult();

            ledger.complete(runId, found, result.saved(), result.skipped(), result.savedIds());
            log.info("Crawl run {} of source '{}' completed: {} found, {} saved, {} skipped, "
                            + "{} not stored",
                    runId, sourceName, found, result.saved(), result.skipped(), result.failed());
            return new CrawlRunOutcome(runId, sourceName, trigger, CrawlRunStatus.COMPLETED,
                    found, result.saved(), result.skipped(), null);
        } catch (Exception e) {
            return recordFailure(runId, sourceName, trigger, found, tally.toResult(), e);
        } catch (Error e) {
            recordFailure(runId, sourceName, trigger, found, tally.toResult(), e);
            throw e;
        } finally {
            advanceMarkers(sourceName, trigger);
            progressTracker.remove(sourceName, runId);
        }
    }

    private CrawlRunOutcome recordFailure(UUID runId, String sourceName, CrawlTrigger trigger,
                                          int found, CommitResult partial, Throwable error) {
        String message = describe(error);
        log.error("Crawl run {} of source '{}' failed: {}", runId, sourceName, message, error);
        CrawlRunStatus status = CrawlRunStatus.FAILED;
        try {
            ledger.fail(runId, message, found, partial.saved(), partial.skipped(),
                    partial.savedIds());
        } catch (RuntimeException e) {
            // the run stays RUNNING until the stale-run sweep picks it up
            log.error("Could not record failure of crawl run {}: {}", runId, e.getMessage(), e);
            status = CrawlRunStatus.RUNNING;
        }
        return new CrawlRunOutcome(runId, sourceName, trigger, status, found, partial.saved(),
                partial.skipped(), message);
    }

    /**
     * @return ids of the runs this process is executing right now
     */
    public Set<UUID> liveRunIds() {
        return progressTracker.snapshot().values().stream()
                .map(CrawlProgress::runId)
                .collect(Collectors.toUnmodifiableSet());
    }

    private void advanceMarkers(String sourceName, CrawlTrigger trigger) {
        try {
            sourceService.markCrawled(sourceName, trigger.isScheduled());
        } catch (RuntimeException e) {
            log.error("Could not update crawl markers of source '{}': {}", sourceName,
                    e.getMessage(), e);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank()
                ? error.getClass().getSimpleName()
                : error.getClass().getSimpleName() + ": " + message;
    }
}
