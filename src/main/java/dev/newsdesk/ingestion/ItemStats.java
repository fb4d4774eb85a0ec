package dev.newsdesk.ingestion;

import org.jspecify.annotations.Nullable;

/**
 * Item counts, overall or for one source.
 *
 * @param sourceName  the source, or {@code null} for all sources
 * @param total       stored items
 * @param processed   items already consumed downstream
 * @param unprocessed items waiting for downstream processing
 */
public record ItemStats(@Nullable String sourceName, long total, long processed, long unprocessed) {
}
