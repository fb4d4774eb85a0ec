package dev.newsdesk.adapter;

import java.util.Map;

/**
 * Parsed content of one item, as produced by {@link SourceAdapter#parseItem}.
 *
 * @param title    item headline
 * @param body     extracted text
 * @param metadata free-form fields (author, published date, category...)
 */
public record ItemData(String title, String body, Map<String, Object> metadata) {

    public ItemData {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
