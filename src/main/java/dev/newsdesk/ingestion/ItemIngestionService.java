package dev.newsdesk.ingestion;

import java.util.List;

import dev.newsdesk.crawl.CrawledItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Dedup and persistence gate for crawl batches.
 *
 * <p>Each item is looked up by content hash and inserted only when absent. The lookup and the
 * insert are not atomic: when a concurrent run inserts the same hash first, the unique constraint
 * rejects the second insert and the item is counted as skipped. Every item is written in its own
 * transaction, so a write error loses only that item and the rest of the batch is still committed.
 */
@Service
public class ItemIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ItemIngestionService.class);

    private final ItemRecordRepository itemRecordRepository;

    public ItemIngestionService(ItemRecordRepository itemRecordRepository) {
        this.itemRecordRepository = itemRecordRepository;
    }

    public CommitResult commit(List<CrawledItem> batch) {
        IngestionTally tally = new IngestionTally();
        commit(batch, tally);
        return tally.toResult();
    }

    /**
     * Commit a batch, accumulating into a caller-owned tally.
     *
     * @param batch items of one crawl run
     * @param tally receives the counts as items are processed
     */
    public void commit(List<CrawledItem> batch, IngestionTally tally) {
        for (CrawledItem item : batch) {
            commitOne(item, tally);
        }
        CommitResult result = tally.toResult();
        log.debug("Committed batch of {}: {} saved, {} skipped, {} failed", batch.size(),
                result.saved(), result.skipped(), result.failed());
    }

    private void commitOne(CrawledItem item, IngestionTally tally) {
        try {
            if (itemRecordRepository.existsByContentHash(item.contentHash())) {
                tally.recordSkipped();
                return;
            }
            ItemRecord saved = itemRecordRepository.saveAndFlush(ItemRecord.from(item));
            tally.recordSaved(saved.getId());
        } catch (DataIntegrityViolationException e) {
            if (storedConcurrently(item)) {
                log.debug("Item {} was stored concurrently, skipping", item.identifier());
                tally.recordSkipped();
            } else {
                log.warn("Rejected item {} of source '{}': {}", item.identifier(),
                        item.sourceName(), e.getMessage());
                tally.recordFailed();
            }
        } catch (DataAccessException e) {
            log.warn("Failed to store item {} of source '{}': {}", item.identifier(),
                    item.sourceName(), e.getMessage());
            tally.recordFailed();
        }
    }

    private boolean storedConcurrently(CrawledItem item) {
        try {
            return itemRecordRepository.existsByContentHash(item.contentHash());
        } catch (DataAccessException e) {
            return false;
        }
    }
}
