package dev.newsdesk.run;

import java.util.Set;

/**
 * Hands a crawl run to whatever executes it and returns at once.
 */
public interface CrawlDispatcher {

    /**
     * @param sourceName the source to crawl
     * @param baseUrl    base address to crawl from
     * @param scheduled  whether the scheduler started the run
     * @return a handle identifying the dispatch
     * @throws DispatchRejectedException when the run cannot be accepted
     */
    DispatchHandle dispatch(String sourceName, String baseUrl, boolean scheduled);

    /**
     * Sources dispatched by this process whose run has not returned yet, queued ones included.
     * A local hint only; the run ledger decides whether a source is running.
     */
    Set<String> pendingSourceNames();
}
