package dev.newsdesk.adapter;

import java.util.Map;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

/**
 * Snapshot of a source handed to an adapter for one crawl run.
 *
 * @param name     the source name
 * @param baseUrl  the site's base address
 * @param settings adapter-specific settings, never null
 */
public record CrawlTarget(String name, String baseUrl, Map<String, Object> settings) {

    public CrawlTarget {
        settings = settings == null ? Map.of() : settings.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static CrawlTarget of(String name, String baseUrl) {
        return new CrawlTarget(name, baseUrl, Map.of());
    }

    /**
     * @return the setting rendered as a string, or {@code null} when unset or blank
     */
    public @Nullable String setting(String key) {
        Object value = settings.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().strip();
        return text.isEmpty() ? null : text;
    }

    /**
     * @return the setting as an integer, or {@code defaultValue} when unset or not a number
     */
    public int intSetting(String key, int defaultValue) {
        Object value = settings.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.strip());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
