package dev.newsdesk.api;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import dev.newsdesk.ingestion.ItemRecord;

/**
 * An item as returned by the API. List responses truncate the body to
 * {@value #PREVIEW_LENGTH} characters unless the full content is requested.
 */
public record ItemView(
        UUID id,
        String sourceName,
        String identifier,
        String contentHash,
        String title,
        String body,
        boolean truncated,
        Map<String, Object> metadata,
        Instant retrievedAt,
        boolean processed
) {

    static final int PREVIEW_LENGTH = 500;

    static ItemView full(ItemRecord item) {
        return of(item, false);
    }

    static ItemView preview(ItemRecord item) {
        return of(item, true);
    }

    private static ItemView of(ItemRecord item, boolean truncate) {
        String body = item.getBody();
        boolean truncated = truncate && body.length() > PREVIEW_LENGTH;
        if (truncated) {
            body = body.substring(0, PREVIEW_LENGTH) + "...";
        }
        return new ItemView(item.getId(), item.getSourceName(), item.getIdentifier(),
                item.getContentHash(), item.getTitle(), body, truncated, item.getMetadata(),
                item.getRetrievedAt(), item.isProcessed());
    }
}
