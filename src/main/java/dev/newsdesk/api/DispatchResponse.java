package dev.newsdesk.api;

import java.time.Instant;
import java.util.UUID;

import dev.newsdesk.ledger.CrawlTrigger;
import dev.newsdesk.run.DispatchHandle;

public record DispatchResponse(UUID dispatchId, String sourceName, CrawlTrigger trigger,
                               Instant dispatchedAt) {

    static DispatchResponse from(DispatchHandle handle) {
        return new DispatchResponse(handle.dispatchId(), handle.sourceName(), handle.trigger(),
                handle.dispatchedAt());
    }
}
