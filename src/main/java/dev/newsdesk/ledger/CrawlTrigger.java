package dev.newsdesk.ledger;

/** What started a crawl run. Only scheduled runs move a source's schedule. */
public enum CrawlTrigger {
    SCHEDULED,
    MANUAL;

    public static CrawlTrigger of(boolean scheduled) {
        return scheduled ? SCHEDULED : MANUAL;
    }

    public boolean isScheduled() {
        return this == SCHEDULED;
    }
}
