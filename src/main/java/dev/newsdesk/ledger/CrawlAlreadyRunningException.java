package dev.newsdesk.ledger;

/**
 * A crawl run could not be opened because the source already has one in {@code RUNNING} state.
 */
public class CrawlAlreadyRunningException extends RuntimeException {

    private final String sourceName;

    public CrawlAlreadyRunningException(String sourceName) {
        super("A crawl of source '" + sourceName + "' is already running");
        this.sourceName = sourceName;
    }

    public CrawlAlreadyRunningException(String sourceName, Throwable cause) {
        super("A crawl of source '" + sourceName + "' is already running", cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
