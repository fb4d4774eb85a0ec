package dev.newsdesk.ledger;

import java.util.UUID;

public class CrawlRunNotFoundException extends RuntimeException {

    public CrawlRunNotFoundException(UUID runId) {
        super("Crawl run not found: " + runId);
    }
}
