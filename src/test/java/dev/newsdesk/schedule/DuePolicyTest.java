package dev.newsdesk.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import dev.newsdesk.fixture.SourceBuilder;
import dev.newsdesk.source.Source;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DuePolicyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void neverCrawledSourceIsDue() {
        Source source = new SourceBuilder().intervalMinutes(60).build();

        assertThat(DuePolicy.isDue(source, NOW)).isTrue();
        assertThat(DuePolicy.overdueBy(source, NOW)).isEqualTo(Duration.ZERO);
    }

    @Test
    void dueExactlyWhenIntervalHasElapsed() {
        Source source = new SourceBuilder().intervalMinutes(15)
                .lastScheduledCrawlAt(NOW.minus(Duration.ofMinutes(15)))
                .build();

        assertThat(DuePolicy.isDue(source, NOW)).isTrue();
        assertThat(DuePolicy.isDue(source, NOW.minusSeconds(1))).isFalse();
    }

    @Test
    void scheduledMarkerWinsOverManualCrawl() {
        Source source = new SourceBuilder().intervalMinutes(60)
                .lastScheduledCrawlAt(NOW.minus(Duration.ofMinutes(61)))
                .lastCrawlAt(NOW.minus(Duration.ofMinutes(5)))
                .build();

        assertThat(DuePolicy.reference(source)).isEqualTo(NOW.minus(Duration.ofMinutes(61)));
        assertThat(DuePolicy.isDue(source, NOW)).isTrue();
    }

    @Test
    void lastCrawlIsTheFallbackReference() {
        Source source = new SourceBuilder().intervalMinutes(60)
                .lastCrawlAt(NOW.minus(Duration.ofMinutes(5)))
                .build();

        assertThat(DuePolicy.isDue(source, NOW)).isFalse();
    }

    @Test
    void longOverdueSourceIsDueOnceWithLateness() {
        Source source = new SourceBuilder().intervalMinutes(10)
                .lastScheduledCrawlAt(NOW.minus(Duration.ofMinutes(95)))
                .build();

        assertThat(DuePolicy.isDue(source, NOW)).isTrue();
        assertThat(DuePolicy.overdueBy(source, NOW)).isEqualTo(Duration.ofMinutes(85));
    }

    @Test
    void notDueSourceIsNotOverdue() {
        Source source = new SourceBuilder().intervalMinutes(30)
                .lastScheduledCrawlAt(NOW.minus(Duration.ofMinutes(10)))
                .build();

        assertThat(DuePolicy.overdueBy(source, NOW)).isEqualTo(Duration.ZERO);
    }
}
