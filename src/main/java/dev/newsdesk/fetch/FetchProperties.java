package dev.newsdesk.fetch;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Network settings shared by every fetch.
 *
 * @param connectTimeoutMs TCP connect timeout per attempt
 * @param readTimeoutMs response read timeout per attempt
 * @param maxRetries total attempts for a transient failure, including the first one
 * @param retryDelayMs fixed pause between attempts; 0 disables the pause
 * @param userAgent value sent in the {@code User-Agent} header
 */
@ConfigurationProperties(prefix = "newsdesk.fetch")
public record FetchProperties(
        int connectTimeoutMs,
        int readTimeoutMs,
        int maxRetries,
        long retryDelayMs,
        String userAgent
) {
    public FetchProperties {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("newsdesk.fetch.max-retries must be >= 1, got: " + maxRetries);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("newsdesk.fetch.retry-delay-ms must be >= 0, got: " + retryDelayMs);
        }
    }
}
