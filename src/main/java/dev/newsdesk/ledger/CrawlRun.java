package dev.newsdesk.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * Ledger entry for one attempt to crawl one source.
 *
 * <p>Created in {@link CrawlRunStatus#RUNNING} before any network activity. Moves to a terminal
 * state exactly once through {@link #markCompleted} or {@link #markFailed}; a second terminal
 * write is rejected with {@link IllegalStateException}.
 */
@Entity
@Table(name = "crawl_runs")
public class CrawlRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_name", nullable = false, length = 100)
    private String sourceName;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    private CrawlTrigger trigger;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "last_heartbeat_at", nullable = false)
    private Instant lastHeartbeatAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CrawlRunStatus status = CrawlRunStatus.RUNNING;

    @Column(name = "items_found", nullable = false)
    private int itemsFound;

    @Column(name = "items_saved", nullable = false)
    private int itemsSaved;

    @Column(name = "items_skipped", nullable = false)
    private int itemsSkipped;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "saved_item_ids", columnDefinition = "JSONB")
    private List<String> savedItemIds = new ArrayList<>();

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "duration_ms")
    private Long durationMs;

    protected CrawlRun() {
        // JPA requires no-arg constructor
    }

    public CrawlRun(String sourceName, CrawlTrigger trigger, Instant startedAt) {
        this.sourceName = sourceName;
        this.trigger = trigger;
        this.startedAt = startedAt;
        this.lastHeartbeatAt = startedAt;
    }

    /**
     * @throws IllegalStateException if the run already reached a terminal state
     */
    public void markCompleted(Instant endedAt, int found, int saved, int skipped,
                              List<UUID> savedIds) {
        finish(CrawlRunStatus.COMPLETED, endedAt, found, saved, skipped, savedIds);
    }

    /**
     * Record a failure, keeping whatever counts were reached before it.
     *
     * @throws IllegalStateException if the run already reached a terminal state
     */
    public void markFailed(Instant endedAt, String errorMessage, int found, int saved,
                           int skipped, List<UUID> savedIds) {
        finish(CrawlRunStatus.FAILED, endedAt, found, saved, skipped, savedIds);
        this.errorMessage = errorMessage;
    }

    private void finish(CrawlRunStatus terminal, Instant endedAt, int found, int saved,
                        int skipped, List<UUID> savedIds) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Crawl run " + id + " is already " + status + ", cannot mark " + terminal);
        }
        this.status = terminal;
        this.endedAt = endedAt;
        this.itemsFound = found;
        this.itemsSaved = saved;
        this.itemsSkipped = skipped;
        this.savedItemIds = savedIds.stream().map(UUID::toString).collect(
                Collectors.toCollection(ArrayList::new));
        this.durationMs = Duration.between(startedAt, endedAt).toMillis();
    }

    public UUID getId() {
        return id;
    }

    public String getSourceName() {
        return sourceName;
    }

    public CrawlTrigger getTrigger() {
        return trigger;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * @return when the executing process last reported this run alive; equals the start time
     *         until the first heartbeat
     */
    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public @Nullable Instant getEndedAt() {
        return endedAt;
    }

    public CrawlRunStatus getStatus() {
        return status;
    }

    public int getItemsFound() {
        return itemsFound;
    }

    public int getItemsSaved() {
        return itemsSaved;
    }

    public int getItemsSkipped() {
        return itemsSkipped;
    }

    public List<String> getSavedItemIds() {
        return savedItemIds == null ? List.of() : List.copyOf(savedItemIds);
    }

    public @Nullable String getErrorMessage() {
        return errorMessage;
    }

    public @Nullable Long getDurationMs() {
        return durationMs;
    }
}
