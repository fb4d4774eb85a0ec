package dev.newsdesk.schedule;

import java.time.Duration;
import java.time.Instant;

import dev.newsdesk.source.Source;
import org.jspecify.annotations.Nullable;

/**
 * Due-ness of a source. The reference point is the last scheduler-started crawl, falling back to
 * the last crawl of any kind; a source with neither is due at once. Otherwise it is due when a full
 * interval has elapsed since the reference.
 *
 * <p>There is no backfill: a source overdue by many intervals is simply due.
 */
public final class DuePolicy {

    private DuePolicy() {
        // utility class
    }

    public static @Nullable Instant reference(Source source) {
        return source.getLastScheduledCrawlAt() != null
                ? source.getLastScheduledCrawlAt()
                : source.getLastCrawlAt();
    }

    public static boolean isDue(Source source, Instant now) {
        return isDue(reference(source), source.getCrawlIntervalMinutes(), now);
    }

    static boolean isDue(@Nullable Instant reference, int intervalMinutes, Instant now) {
        if (reference == null) {
            return true;
        }
        return !now.isBefore(reference.plus(Duration.ofMinutes(intervalMinutes)));
    }

    /**
     * @return how far past its due time the source is, or {@link Duration#ZERO} when it is not due
     *         or has never been crawled
     */
    public static Duration overdueBy(Source source, Instant now) {
        Instant reference = reference(source);
        if (reference == null) {
            return Duration.ZERO;
        }
        Duration late = Duration.between(
                reference.plus(Duration.ofMinutes(source.getCrawlIntervalMinutes())), now);
        return late.isNegative() ? Duration.ZERO : late;
    }
}
