package dev.newsdesk.source;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Partial update of a source; {@code null} fields are left unchanged. */
public record SourceUpdate(
    @Nullable @Size(max = 500) String baseUrl,
    @Nullable Boolean active,
    @Nullable @Positive Integer crawlIntervalMinutes,
    @Nullable Map<String, Object> settings) {}
