package dev.newsdesk.api;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import dev.newsdesk.crawl.CrawlProgress;
import dev.newsdesk.crawl.CrawlProgressTracker;
import dev.newsdesk.ledger.CrawlAlreadyRunningException;
import dev.newsdesk.ledger.CrawlRunLedger;
import dev.newsdesk.ledger.CrawlRunStatus;
import dev.newsdesk.run.CrawlDispatcher;
import dev.newsdesk.schedule.CrawlScheduler;
import dev.newsdesk.schedule.TickSummary;
import dev.newsdesk.source.Source;
import dev.newsdesk.source.SourceService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual crawls, the crawl run ledger and on-demand scheduler ticks.
 */
@RestController
@RequestMapping("/api/crawls")
public class CrawlController {

    private static final Logger log = LoggerFactory.getLogger(CrawlController.class);

    static final int MAX_PAGE_SIZE = 200;

    private final SourceService sourceService;
    private final CrawlRunLedger ledger;
    private final CrawlDispatcher dispatcher;
    private final CrawlProgressTracker progressTracker;
    private final CrawlScheduler crawlScheduler;

    public CrawlController(SourceService sourceService,
                           CrawlRunLedger ledger,
                           CrawlDispatcher dispatcher,
                           CrawlProgressTracker progressTracker,
                           CrawlScheduler crawlScheduler) {
        this.sourceService = sourceService;
        this.ledger = ledger;
        this.dispatcher = dispatcher;
        this.progressTracker = progressTracker;
        this.crawlScheduler = crawlScheduler;
    }

    /**
     * Start a manual crawl. Manual runs never move the source's schedule. Rejected with 409 while
     * the source is running or already waiting in this process's run queue.
     */
    @PostMapping("/{sourceName}")
    public ResponseEntity<DispatchResponse> trigger(@PathVariable String sourceName) {
        Source source = sourceService.getByName(sourceName);
        if (ledger.isRunning(source.getName())
                || dispatcher.pendingSourceNames().contains(source.getName())) {
            throw new CrawlAlreadyRunningException(source.getName());
        }
        log.info("Manual crawl of source '{}' requested", source.getName());
        DispatchResponse response = DispatchResponse.from(
                dispatcher.dispatch(source.getName(), source.getBaseUrl(), false));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/runs")
    public PageView<CrawlRunView> runs(@RequestParam(required = false) @Nullable String source,
                                       @RequestParam(required = false) @Nullable CrawlRunStatus status,
                                       @RequestParam(defaultValue = "0") int page,
                                       @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = pageRequest(page, size, Sort.by(Sort.Direction.DESC, "startedAt"));
        return PageView.of(ledger.search(source, status, pageable), CrawlRunView::from);
    }

    @GetMapping("/runs/{id}")
    public CrawlRunView run(@PathVariable UUID id) {
        return CrawlRunView.from(ledger.get(id));
    }

    /**
     * Runs the ledger shows as running, with live progress for those executing here.
     */
    @GetMapping("/active")
    public List<ActiveCrawlView> active() {
        Map<String, CrawlProgress> progress = progressTracker.snapshot();
        return ledger.runningRuns().stream()
                .map(run -> ActiveCrawlView.from(run, progress.get(run.getSourceName())))
                .toList();
    }

    @PostMapping("/tick")
    public TickSummary tick() {
        return crawlScheduler.tick();
    }

    static PageRequest pageRequest(int page, int size, Sort sort) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0, got: " + page);
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException(
                    "size must be between 1 and " + MAX_PAGE_SIZE + ", got: " + size);
        }
        return PageRequest.of(page, size, sort);
    }
}
