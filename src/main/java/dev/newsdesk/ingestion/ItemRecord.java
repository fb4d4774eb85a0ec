package dev.newsdesk.ingestion;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import dev.newsdesk.crawl.CrawledItem;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One persisted crawled article.
 *
 * <p>The content hash is unique across the store; a second item with the same hash is never
 * inserted. Apart from {@code processed}, which belongs to downstream consumers, records are
 * written once and not modified by the crawler.
 */
@Entity
@Table(name = "item_records")
public class ItemRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_name", nullable = false, length = 100)
    private String sourceName;

    @Column(nullable = false, length = 2048)
    private String identifier;

    @Column(name = "content_hash", nullable = false, unique = true, length = 64)
    private String contentHash;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String body;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "JSONB")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "retrieved_at", nullable = false, updatable = false)
    private Instant retrievedAt;

    @Column(nullable = false)
    private boolean processed;

    protected ItemRecord() {
        // JPA requires no-arg constructor
    }

    public ItemRecord(String sourceName, String identifier, String contentHash, String title,
                      String body, Map<String, Object> metadata) {
        this.sourceName = sourceName;
        this.identifier = identifier;
        this.contentHash = contentHash;
        this.title = title;
        this.body = body;
        this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    }

    public static ItemRecord from(CrawledItem item) {
        return new ItemRecord(item.sourceName(), item.identifier(), item.contentHash(),
                item.title(), item.body(), item.metadata());
    }

    @PrePersist
    protected void onCreate() {
        if (this.retrievedAt == null) {
            this.retrievedAt = Instant.now();
        }
    }

    public UUID getId() {
        return id;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getContentHash() {
        return contentHash;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public Map<String, Object> getMetadata() {
        return metadata == null ? Map.of() : Collections.unmodifiableMap(metadata);
    }

    public Instant getRetrievedAt() {
        return retrievedAt;
    }

    public void setRetrievedAt(Instant retrievedAt) {
        this.retrievedAt = retrievedAt;
    }

    public boolean isProcessed() {
        return processed;
    }

    public void setProcessed(boolean processed) {
        this.processed = processed;
    }
}
