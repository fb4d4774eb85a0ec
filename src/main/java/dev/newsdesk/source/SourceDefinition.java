package dev.newsdesk.source;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Everything needed to register a new source.
 *
 * @param name                 unique name, also the default adapter key
 * @param baseUrl              base address of the site
 * @param active               whether the scheduler should consider it ({@code null} means true)
 * @param crawlIntervalMinutes minutes between scheduled crawls
 * @param settings             adapter-specific settings such as {@code adapter} or {@code feedUrl}
 */
public record SourceDefinition(
    @NotBlank @Size(max = 100) String name,
    @NotBlank @Size(max = 500) String baseUrl,
    @Nullable Boolean active,
    @Positive int crawlIntervalMinutes,
    @Nullable Map<String, Object> settings) {}
