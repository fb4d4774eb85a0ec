package dev.newsdesk.crawl;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for running crawls, keyed by source name.
 *
 * <p>Each update atomically replaces the snapshot with {@code computeIfPresent()}, so updates for a
 * source that is not tracked are ignored. Data is lost on restart; the run ledger is the
 * persistent record.
 */
@Component
public class CrawlProgressTracker {

  private final ConcurrentHashMap<String, CrawlProgress> activeCrawls = new ConcurrentHashMap<>();
  private final Clock clock;

  public CrawlProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Start tracking a crawl run, replacing any leftover snapshot for the source.
   *
   * @param sourceName the source being crawled
   * @param runId the ledger entry of the run
   */
  public void start(String sourceName, UUID runId) {
    activeCrawls.put(
        sourceName,
        new CrawlProgress(
            sourceName, runId, CrawlProgress.Phase.DISCOVERING, 0, 0, 0, clock.instant()));
  }

  public void recordCandidates(String sourceName, int total) {
    activeCrawls.computeIfPresent(sourceName, (name, progress) -> progress.withCandidates(total));
  }

  public void recordItemParsed(String sourceName) {
    activeCrawls.computeIfPresent(sourceName, (name, progress) -> progress.withItemParsed());
  }

  public void recordItemFailed(String sourceName) {
    activeCrawls.computeIfPresent(sourceName, (name, progress) -> progress.withItemFailed());
  }

  public void recordCommitting(String sourceName) {
    activeCrawls.computeIfPresent(
        sourceName, (name, progress) -> progress.withPhase(CrawlProgress.Phase.COMMITTING));
  }

  public Optional<CrawlProgress> getProgress(String sourceName) {
    return Optional.ofNullable(activeCrawls.get(sourceName));
  }

  /** Copy of all tracked crawls. */
  public Map<String, CrawlProgress> snapshot() {
    return Map.copyOf(activeCrawls);
  }

  /**
   * Stop tracking a run. Only removes the snapshot if it still belongs to the given run.
   *
   * @param sourceName the source that finished crawling
   * @param runId the run that finished
   */
  public void remove(String sourceName, UUID runId) {
    activeCrawls.computeIfPresent(
        sourceName, (name, progress) -> progress.runId().equals(runId) ? null : progress);
  }
}
