package dev.newsdesk.adapter;

import java.util.List;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Per-source discovery and parsing logic consumed by the crawl orchestrator.
 *
 * <p>Implementations are Spring beans collected by {@link SourceAdapterRegistry} under their
 * {@link #key()}.
 */
public interface SourceAdapter {

    /**
     * @return the registry key this adapter answers to
     */
    String key();

    /**
     * List candidate item identifiers (usually article URLs) for the target.
     *
     * @param target the source being crawled
     * @param limit  maximum number of candidates, or {@code null} for no limit
     * @return candidate identifiers, possibly empty
     * @throws RuntimeException when discovery itself fails; this fails the whole crawl run
     */
    List<String> listCandidates(CrawlTarget target, @Nullable Integer limit);

    /**
     * Fetch and parse one candidate.
     *
     * @param target     the source being crawled
     * @param identifier one identifier returned by {@link #listCandidates}
     * @return the parsed item, or empty when the item is missing or not parseable
     */
    Optional<ItemData> parseItem(CrawlTarget target, String identifier);
}
