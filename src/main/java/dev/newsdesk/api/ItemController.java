package dev.newsdesk.api;

import java.util.UUID;
import java.util.function.Function;

import dev.newsdesk.ingestion.ItemQueryService;
import dev.newsdesk.ingestion.ItemRecord;
import dev.newsdesk.ingestion.ItemStats;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.Sort;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Stored items. Listings return body previews unless {@code full=true}.
 */
@RestController
@RequestMapping("/api/items")
public class ItemController {

    private final ItemQueryService itemQueryService;

    public ItemController(ItemQueryService itemQueryService) {
        this.itemQueryService = itemQueryService;
    }

    @GetMapping
    public PageView<ItemView> list(@RequestParam(required = false) @Nullable String source,
                                   @RequestParam(defaultValue = "0") int page,
                                   @RequestParam(defaultValue = "20") int size,
                                   @RequestParam(defaultValue = "false") boolean full) {
        var pageable = CrawlController.pageRequest(page, size,
                Sort.by(Sort.Direction.DESC, "retrievedAt"));
        Function<ItemRecord, ItemView> view = full ? ItemView::full : ItemView::preview;
        return PageView.of(itemQueryService.list(source, pageable), view);
    }

    @GetMapping("/stats")
    public ItemStats stats(@RequestParam(required = false) @Nullable String source) {
        return itemQueryService.stats(source);
    }

    @GetMapping("/{id}")
    public ItemView get(@PathVariable UUID id) {
        return ItemView.full(itemQueryService.get(id));
    }
}
