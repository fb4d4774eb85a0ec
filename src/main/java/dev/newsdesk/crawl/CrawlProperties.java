package dev.newsdesk.crawl;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Crawl execution settings.
 *
 * @param maxConcurrentItems items of one crawl fetched and parsed at the same time
 * @param candidateLimit optional cap on candidates per run, passed to the adapter
 * @param runPoolSize worker threads executing whole crawl runs
 * @param itemPoolSize worker threads shared by all runs for item fetches
 * @param queueCapacity pending tasks accepted by each pool
 */
@ConfigurationProperties(prefix = "newsdesk.crawl")
public record CrawlProperties(
    int maxConcurrentItems,
    @Nullable Integer candidateLimit,
    int runPoolSize,
    int itemPoolSize,
    int queueCapacity) {

  public CrawlProperties {
    if (maxConcurrentItems < 1) {
      throw new IllegalArgumentException(
          "newsdesk.crawl.max-concurrent-items must be >= 1, got: " + maxConcurrentItems);
    }
    if (candidateLimit != null && candidateLimit < 1) {
      throw new IllegalArgumentException(
          "newsdesk.crawl.candidate-limit must be >= 1 when set, got: " + candidateLimit);
    }
    if (runPoolSize < 1 || itemPoolSize < 1 || queueCapacity < 1) {
      throw new IllegalArgumentException("newsdesk.crawl pool sizes must be >= 1");
    }
  }
}
