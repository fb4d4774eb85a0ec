package dev.newsdesk.ingestion;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of committing one crawl batch.
 *
 * @param saved    items inserted
 * @param skipped  items whose content hash was already stored
 * @param failed   items that could not be written
 * @param savedIds ids of the inserted records
 */
public record CommitResult(int saved, int skipped, int failed, List<UUID> savedIds) {

    public CommitResult {
        savedIds = savedIds == null ? List.of() : List.copyOf(savedIds);
    }

    public static CommitResult empty() {
        return new CommitResult(0, 0, 0, List.of());
    }
}
