package dev.newsdesk.ingestion;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Running counts of a commit in progress. Owned by the crawl run, so that the counts reached
 * before an unexpected failure can still be written to the ledger.
 *
 * <p>Not thread-safe; a batch is committed by one thread.
 */
public class IngestionTally {

    private int saved;
    private int skipped;
    private int failed;
    private final List<UUID> savedIds = new ArrayList<>();

    void recordSaved(UUID id) {
        saved++;
        savedIds.add(id);
    }

    void recordSkipped() {
        skipped++;
    }

    void recordFailed() {
        failed++;
    }

    public CommitResult toResult() {
        return new CommitResult(saved, skipped, failed, savedIds);
    }
}
