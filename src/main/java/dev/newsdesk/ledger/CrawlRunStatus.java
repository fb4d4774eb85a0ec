package dev.newsdesk.ledger;

/**
 * Lifecycle of a crawl run: {@code RUNNING -> COMPLETED} or {@code RUNNING -> FAILED}. Terminal
 * states are final.
 */
public enum CrawlRunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
