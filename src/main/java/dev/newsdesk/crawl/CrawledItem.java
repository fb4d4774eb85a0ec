package dev.newsdesk.crawl;

import java.util.Map;

/**
 * One parsed item of a crawl batch, tagged with its owning source and dedup key.
 *
 * @param sourceName  the source the item was crawled from
 * @param identifier  source-assigned identifier, usually the article URL
 * @param contentHash {@link ContentHasher#forIdentifier} of the identifier
 * @param title       item headline
 * @param body        extracted text
 * @param metadata    free-form adapter metadata
 */
public record CrawledItem(
    String sourceName,
    String identifier,
    String contentHash,
    String title,
    String body,
    Map<String, Object> metadata) {

  public CrawledItem {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
