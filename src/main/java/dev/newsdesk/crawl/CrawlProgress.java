package dev.newsdesk.crawl;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a running crawl's progress.
 *
 * <p>Created and updated by {@link CrawlProgressTracker}. Each mutation produces a new record.
 * This is an in-memory hint for operators; whether a source is crawling is decided by the run
 * ledger alone.
 *
 * @param sourceName      the source being crawled
 * @param runId           the ledger entry of the run
 * @param phase           current phase of the run
 * @param candidatesTotal candidates returned by discovery
 * @param itemsParsed     items fetched and parsed so far
 * @param itemsFailed     items that failed or were not parseable
 * @param startedAt       when tracking started
 */
public record CrawlProgress(
    String sourceName,
    UUID runId,
    Phase phase,
    int candidatesTotal,
    int itemsParsed,
    int itemsFailed,
    Instant startedAt) {

  /** Phases of one crawl run. */
  public enum Phase {
    DISCOVERING,
    FETCHING,
    COMMITTING
  }

  CrawlProgress withPhase(Phase newPhase) {
    return new CrawlProgress(
        sourceName, runId, newPhase, candidatesTotal, itemsParsed, itemsFailed, startedAt);
  }

  CrawlProgress withCandidates(int total) {
    return new CrawlProgress(
        sourceName, runId, Phase.FETCHING, total, itemsParsed, itemsFailed, startedAt);
  }

  CrawlProgress withItemParsed() {
    return new CrawlProgress(
        sourceName, runId, phase, candidatesTotal, itemsParsed + 1, itemsFailed, startedAt);
  }

  CrawlProgress withItemFailed() {
    return new CrawlProgress(
        sourceName, runId, phase, candidatesTotal, itemsParsed, itemsFailed + 1, startedAt);
  }
}
