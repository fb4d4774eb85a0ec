package dev.newsdesk.source;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * Configuration of one crawlable news source.
 *
 * <p>The name is the natural key used everywhere else (ledger entries, item records, adapter
 * lookup). Two markers record when the source was last crawled: {@code lastCrawlAt} moves after
 * every finished run, {@code lastScheduledCrawlAt} only after runs started by the scheduler, and
 * is the field due-ness is computed from.
 *
 * <p>Maps to the {@code sources} table managed by Flyway migrations.
 *
 * @see SourceService
 */
@Entity
@Table(name = "sources")
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "base_url", nullable = false, length = 500)
    private String baseUrl;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "crawl_interval_minutes", nullable = false)
    private int crawlIntervalMinutes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "JSONB")
    private Map<String, Object> settings = new LinkedHashMap<>();

    @Column(name = "last_crawl_at")
    private Instant lastCrawlAt;

    @Column(name = "last_scheduled_crawl_at")
    private Instant lastScheduledCrawlAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Source() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates an active source that has never been crawled.
     *
     * @param name                 unique source name, also the default adapter key
     * @param baseUrl              the site's base address
     * @param crawlIntervalMinutes minutes between scheduled crawls, must be positive
     */
    public Source(String name, String baseUrl, int crawlIntervalMinutes) {
        this.name = name;
        this.baseUrl = baseUrl;
        setCrawlIntervalMinutes(crawlIntervalMinutes);
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public int getCrawlIntervalMinutes() {
        return crawlIntervalMinutes;
    }

    public void setCrawlIntervalMinutes(int crawlIntervalMinutes) {
        if (crawlIntervalMinutes <= 0) {
            throw new IllegalArgumentException(
                    "Crawl interval must be positive, got: " + crawlIntervalMinutes);
        }
        this.crawlIntervalMinutes = crawlIntervalMinutes;
    }

    public Map<String, Object> getSettings() {
        return settings == null ? Map.of() : Collections.unmodifiableMap(settings);
    }

    public void setSettings(@Nullable Map<String, Object> settings) {
        this.settings = settings == null ? new LinkedHashMap<>() : new LinkedHashMap<>(settings);
    }

    public @Nullable Instant getLastCrawlAt() {
        return lastCrawlAt;
    }

    public @Nullable Instant getLastScheduledCrawlAt() {
        return lastScheduledCrawlAt;
    }

    /**
     * Advance the crawl markers after a finished run. Manual runs leave the scheduled marker
     * untouched so they never shift the periodic schedule.
     *
     * @param finishedAt when the run finished
     * @param scheduled  whether the scheduler started the run
     */
    public void recordCrawl(Instant finishedAt, boolean scheduled) {
        this.lastCrawlAt = finishedAt;
        if (scheduled) {
            this.lastScheduledCrawlAt = finishedAt;
        }
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
