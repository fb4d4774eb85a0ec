package dev.newsdesk.ingestion;

import java.util.UUID;

import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read access to stored items for the REST layer. */
@Service
@Transactional(readOnly = true)
public class ItemQueryService {

    private final ItemRecordRepository itemRecordRepository;

    public ItemQueryService(ItemRecordRepository itemRecordRepository) {
        this.itemRecordRepository = itemRecordRepository;
    }

    public Page<ItemRecord> list(@Nullable String sourceName, Pageable pageable) {
        return sourceName == null
                ? itemRecordRepository.findAll(pageable)
                : itemRecordRepository.findAllBySourceName(sourceName, pageable);
    }

    /**
     * @throws ItemNotFoundException if no item has this id
     */
    public ItemRecord get(UUID id) {
        return itemRecordRepository.findById(id).orElseThrow(() -> new ItemNotFoundException(id));
    }

    public ItemStats stats(@Nullable String sourceName) {
        long total;
        long processed;
        if (sourceName == null) {
            total = itemRecordRepository.count();
            processed = itemRecordRepository.countByProcessedTrue();
        } else {
            total = itemRecordRepository.countBySourceName(sourceName);
            processed = itemRecordRepository.countBySourceNameAndProcessedTrue(sourceName);
        }
        return new ItemStats(sourceName, total, processed, total - processed);
    }
}
