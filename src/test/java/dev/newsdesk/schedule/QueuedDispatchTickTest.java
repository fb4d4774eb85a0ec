package dev.newsdesk.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.newsdesk.fixture.SourceBuilder;
import dev.newsdesk.ledger.CrawlRunLedger;
import dev.newsdesk.ledger.CrawlTrigger;
import dev.newsdesk.run.CrawlRunner;
import dev.newsdesk.run.ExecutorCrawlDispatcher;
import dev.newsdesk.source.Source;
import dev.newsdesk.source.SourceService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Ticks against the real dispatcher while the run pool has no free thread, so dispatched runs sit
 * in its queue without a ledger entry.
 */
@ExtendWith(MockitoExtension.class)
class QueuedDispatchTickTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private SourceService sourceService;
    @Mock
    private CrawlRunLedger ledger;
    @Mock
    private CrawlRunner crawlRunner;

    private final List<Runnable> runQueue = new ArrayList<>();
    private CrawlScheduler scheduler;

    @BeforeEach
    void setUp() {
        ExecutorCrawlDispatcher dispatcher =
                new ExecutorCrawlDispatcher(crawlRunner, runQueue::add, CLOCK);
        scheduler = new CrawlScheduler(sourceService, ledger, dispatcher, crawlRunner,
                new SchedulerProperties(), CLOCK);
        Source alpha = new SourceBuilder().name("alpha").baseUrl("https://alpha.example.com")
                .intervalMinutes(15)
                .lastScheduledCrawlAt(NOW.minus(Duration.ofMinutes(20)))
                .build();
        when(sourceService.listActive()).thenReturn(List.of(alpha));
        when(ledger.runningSourceNames()).thenReturn(Set.of());
    }

    @Test
    void queuedRunIsDispatchedOnceAcrossTicks() {
        List<List<String>> triggered = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            triggered.add(scheduler.tick().triggered());
        }

        assertThat(triggered).containsExactly(List.of("alpha"), List.of(), List.of());
        assertThat(runQueue).hasSize(1);

        runQueue.forEach(Runnable::run);

        verify(crawlRunner, times(1))
                .run("alpha", "https://alpha.example.com", CrawlTrigger.SCHEDULED);
    }

    @Test
    void sourceIsEligibleAgainOnceItsRunReturns() {
        assertThat(scheduler.tick().triggered()).containsExactly("alpha");
        runQueue.remove(0).run();

        assertThat(scheduler.tick().triggered()).containsExactly("alpha");
        assertThat(runQueue).hasSize(1);
    }
}
