package dev.newsdesk.api;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import dev.newsdesk.source.Source;
import org.jspecify.annotations.Nullable;

public record SourceView(
        UUID id,
        String name,
        String baseUrl,
        boolean active,
        int crawlIntervalMinutes,
        Map<String, Object> settings,
        @Nullable Instant lastCrawlAt,
        @Nullable Instant lastScheduledCrawlAt,
        Instant createdAt,
        Instant updatedAt
) {

    static SourceView from(Source source) {
        return new SourceView(source.getId(), source.getName(), source.getBaseUrl(),
                source.isActive(), source.getCrawlIntervalMinutes(), source.getSettings(),
                source.getLastCrawlAt(), source.getLastScheduledCrawlAt(), source.getCreatedAt(),
                source.getUpdatedAt());
    }
}
