package dev.newsdesk.fixture;

import dev.newsdesk.source.Source;
import java.lang.reflect.Field;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for the {@link Source} JPA entity. Provides sensible defaults so tests
 * only override what they care about.
 *
 * <pre>{@code
 * Source source = new SourceBuilder().name("wire").intervalMinutes(15).build();
 * }</pre>
 */
public final class SourceBuilder {

  private @Nullable UUID id = UUID.randomUUID();
  private String name = "example-news";
  private String baseUrl = "https://news.example.com";
  private boolean active = true;
  private int intervalMinutes = 15;
  private final Map<String, Object> settings = new LinkedHashMap<>();
  private @Nullable Instant lastCrawlAt;
  private @Nullable Instant lastScheduledCrawlAt;

  public SourceBuilder id(@Nullable UUID id) {
    this.id = id;
    return this;
  }

  public SourceBuilder name(String name) {
    this.name = name;
    return this;
  }

  public SourceBuilder baseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
    return this;
  }

  public SourceBuilder active(boolean active) {
    this.active = active;
    return this;
  }

  public SourceBuilder intervalMinutes(int intervalMinutes) {
    this.intervalMinutes = intervalMinutes;
    return this;
  }

  public SourceBuilder setting(String key, Object value) {
    this.settings.put(key, value);
    return this;
  }

  public SourceBuilder lastCrawlAt(@Nullable Instant lastCrawlAt) {
    this.lastCrawlAt = lastCrawlAt;
    return this;
  }

  public SourceBuilder lastScheduledCrawlAt(@Nullable Instant lastScheduledCrawlAt) {
    this.lastScheduledCrawlAt = lastScheduledCrawlAt;
    return this;
  }

  public Source build() {
    Source source = new Source(name, baseUrl, intervalMinutes);
    if (id != null) {
      setField(source, "id", id);
    }
    source.setActive(active);
    source.setSettings(settings);
    setField(source, "lastCrawlAt", lastCrawlAt);
    setField(source, "lastScheduledCrawlAt", lastScheduledCrawlAt);
    return source;
  }

  private static void setField(Source source, String fieldName, @Nullable Object value) {
    try {
      Field field = Source.class.getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(source, value);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to set field " + fieldName, e);
    }
  }
}
