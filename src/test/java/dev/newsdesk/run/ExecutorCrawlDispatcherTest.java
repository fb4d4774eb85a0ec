package dev.newsdesk.run;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.newsdesk.ledger.CrawlAlreadyRunningException;
import dev.newsdesk.ledger.CrawlRunStatus;
import dev.newsdesk.ledger.CrawlTrigger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExecutorCrawlDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final String BASE_URL = "https://wire.example.com";

    @Mock
    private CrawlRunner crawlRunner;

    @Test
    void scheduledDispatchRunsWithScheduledTrigger() {
        CrawlRunOutcome expected = new CrawlRunOutcome(UUID.randomUUID(), "wire",
                CrawlTrigger.SCHEDULED, CrawlRunStatus.COMPLETED, 3, 3, 0, null);
        when(crawlRunner.run("wire", BASE_URL, CrawlTrigger.SCHEDULED)).thenReturn(expected);
        ExecutorCrawlDispatcher dispatcher =
                new ExecutorCrawlDispatcher(crawlRunner, Runnable::run, CLOCK);

        DispatchHandle handle = dispatcher.dispatch("wire", BASE_URL, true);

        assertThat(handle.sourceName()).isEqualTo("wire");
        assertThat(handle.trigger()).isEqualTo(CrawlTrigger.SCHEDULED);
        assertThat(handle.dispatchedAt()).isEqualTo(NOW);
        assertThat(handle.outcome().join()).isEqualTo(expected);
    }

    @Test
    void manualDispatchUsesManualTrigger() {
        ExecutorCrawlDispatcher dispatcher =
                new ExecutorCrawlDispatcher(crawlRunner, Runnable::run, CLOCK);

        DispatchHandle handle = dispatcher.dispatch("wire", BASE_URL, false);

        assertThat(handle.trigger()).isEqualTo(CrawlTrigger.MANUAL);
        verify(crawlRunner).run("wire", BASE_URL, CrawlTrigger.MANUAL);
    }

    @Test
    void dispatchReturnsBeforeTheRunStarts() {
        Executor parked = task -> { };
        ExecutorCrawlDispatcher dispatcher = new ExecutorCrawlDispatcher(crawlRunner, parked, CLOCK);

        DispatchHandle handle = dispatcher.dispatch("wire", BASE_URL, true);

        assertThat(handle.outcome()).isNotDone();
        verify(crawlRunner, never()).run("wire", BASE_URL, CrawlTrigger.SCHEDULED);
    }

    @Test
    void rejectedRunSurfacesAsDispatchRejected() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };
        ExecutorCrawlDispatcher dispatcher = new ExecutorCrawlDispatcher(crawlRunner, full, CLOCK);

        assertThatThrownBy(() -> dispatcher.dispatch("wire", BASE_URL, true))
                .isInstanceOf(DispatchRejectedException.class)
                .hasMessageContaining("wire");
    }

    @Test
    void concurrentRunEndsTheOutcomeExceptionally() {
        when(crawlRunner.run("wire", BASE_URL, CrawlTrigger.SCHEDULED))
                .thenThrow(new CrawlAlreadyRunningException("wire"));
        ExecutorCrawlDispatcher dispatcher =
                new ExecutorCrawlDispatcher(crawlRunner, Runnable::run, CLOCK);

        DispatchHandle handle = dispatcher.dispatch("wire", BASE_URL, true);

        assertThatThrownBy(() -> handle.outcome().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(CrawlAlreadyRunningException.class);
    }

    @Test
    void queuedRunIsPendingUntilItReturns() {
        List<Runnable> queue = new ArrayList<>();
        ExecutorCrawlDispatcher dispatcher =
                new ExecutorCrawlDispatcher(crawlRunner, queue::add, CLOCK);

        dispatcher.dispatch("wire", BASE_URL, true);
        dispatcher.dispatch("daily", "https://daily.example.com", false);

        assertThat(dispatcher.pendingSourceNames()).containsExactlyInAnyOrder("wire", "daily");

        queue.get(0).run();

        assertThat(dispatcher.pendingSourceNames()).containsExactly("daily");
    }

    @Test
    void sourceDispatchedTwiceStaysPendingUntilBothReturn() {
        List<Runnable> queue = new ArrayList<>();
        ExecutorCrawlDispatcher dispatcher =
                new ExecutorCrawlDispatcher(crawlRunner, queue::add, CLOCK);
        dispatcher.dispatch("wire", BASE_URL, true);
        dispatcher.dispatch("wire", BASE_URL, false);

        queue.get(0).run();
        assertThat(dispatcher.pendingSourceNames()).containsExactly("wire");

        queue.get(1).run();
        assertThat(dispatcher.pendingSourceNames()).isEmpty();
    }

    @Test
    void failedRunIsNoLongerPending() {
        when(crawlRunner.run("wire", BASE_URL, CrawlTrigger.SCHEDULED))
                .thenThrow(new CrawlAlreadyRunningException("wire"));
        ExecutorCrawlDispatcher dispatcher =
                new ExecutorCrawlDispatcher(crawlRunner, Runnable::run, CLOCK);

        dispatcher.dispatch("wire", BASE_URL, true);

        assertThat(dispatcher.pendingSourceNames()).isEmpty();
    }

    @Test
    void rejectedRunIsNoLongerPending() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };
        ExecutorCrawlDispatcher dispatcher = new ExecutorCrawlDispatcher(crawlRunner, full, CLOCK);

        assertThatThrownBy(() -> dispatcher.dispatch("wire", BASE_URL, true))
                .isInstanceOf(DispatchRejectedException.class);
        assertThat(dispatcher.pendingSourceNames()).isEmpty();
    }
}
