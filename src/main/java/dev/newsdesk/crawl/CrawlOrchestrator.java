package dev.newsdesk.crawl;

import dev.newsdesk.adapter.CrawlTarget;
import dev.newsdesk.adapter.ItemData;
import dev.newsdesk.adapter.SourceAdapter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives one crawl of one source: candidate discovery, then bounded-concurrency fetch and parse of
 * every candidate.
 *
 * <p>At most {@code newsdesk.crawl.max-concurrent-items} items of a run are in flight at once; a
 * permit is taken before an item is submitted to the shared item pool and released when it
 * finishes. Failures of individual items are logged and dropped from the batch. Only a failure of
 * discovery itself propagates to the caller.
 *
 * <p>Results come back in candidate order, but nothing downstream relies on it.
 */
@Service
public class CrawlOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);

  private final Executor itemFetchExecutor;
  private final CrawlProperties properties;
  private final CrawlProgressTracker progressTracker;

  public CrawlOrchestrator(
      @Qualifier("itemFetchExecutor") Executor itemFetchExecutor,
      CrawlProperties properties,
      CrawlProgressTracker progressTracker) {
    this.itemFetchExecutor = itemFetchExecutor;
    this.properties = properties;
    this.progressTracker = progressTracker;
  }

  /**
   * Crawl one source.
   *
   * @param target the source snapshot
   * @param adapter the adapter resolved for the source
   * @return parsed items tagged with source name and content hash; empty when nothing was found
   * @throws RuntimeException whatever candidate discovery threw
   * @throws CrawlInterruptedException if the calling thread is interrupted while waiting
   */
  public List<CrawledItem> crawl(CrawlTarget target, SourceAdapter adapter) {
    List<String> discovered = adapter.listCandidates(target, properties.candidateLimit());
    if (discovered == null || discovered.isEmpty()) {
      log.info("No candidates for source '{}'", target.name());
      progressTracker.recordCandidates(target.name(), 0);
      return List.of();
    }
    List<String> candidates = new ArrayList<>(new LinkedHashSet<>(discovered));
    progressTracker.recordCandidates(target.name(), candidates.size());
    log.info(
        "Crawling {} candidates for source '{}' (max {} concurrent)",
        candidates.size(),
        target.name(),
        properties.maxConcurrentItems());

    Semaphore permits = new Semaphore(properties.maxConcurrentItems());
    List<CompletableFuture<Optional<CrawledItem>>> futures = new ArrayList<>(candidates.size());
    try {
      for (String identifier : candidates) {
        permits.acquire();
        futures.add(submit(target, adapter, identifier, permits));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(future -> future.cancel(true));
      throw new CrawlInterruptedException(target.name(), e);
    }

    List<CrawledItem> items = new ArrayList<>();
    for (CompletableFuture<Optional<CrawledItem>> future : futures) {
      future.join().ifPresent(items::add);
    }
    log.info(
        "Source '{}': {} of {} candidates parsed", target.name(), items.size(), candidates.size());
    return items;
  }

  private CompletableFuture<Optional<CrawledItem>> submit(
      CrawlTarget target, SourceAdapter adapter, String identifier, Semaphore permits) {
    try {
      return CompletableFuture.supplyAsync(
              () -> crawlItem(target, adapter, identifier), itemFetchExecutor)
          .whenComplete((result, error) -> permits.release());
    } catch (RejectedExecutionException e) {
      permits.release();
      log.warn("Item {} of source '{}' rejected by the item pool", identifier, target.name());
      progressTracker.recordItemFailed(target.name());
      return CompletableFuture.completedFuture(Optional.empty());
    }
  }

  private Optional<CrawledItem> crawlItem(
      CrawlTarget target, SourceAdapter adapter, String identifier) {
    try {
      Optional<ItemData> parsed = adapter.parseItem(target, identifier);
      if (parsed.isEmpty()) {
        log.debug("No parseable item at {}", identifier);
        progressTracker.recordItemFailed(target.name());
        return Optional.empty();
      }
      ItemData data = parsed.get();
      progressTracker.recordItemParsed(target.name());
      return Optional.of(
          new CrawledItem(
              target.name(),
              identifier,
              ContentHasher.forIdentifier(identifier),
              data.title(),
              data.body(),
              data.metadata()));
    } catch (Exception e) {
      log.warn("Failed to crawl {} for source '{}': {}", identifier, target.name(), e.getMessage());
      progressTracker.recordItemFailed(target.name());
      return Optional.empty();
    }
  }
}
