package dev.newsdesk.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.newsdesk.BaseIntegrationTest;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class CrawlRunLedgerIT extends BaseIntegrationTest {

    @Autowired
    CrawlRunLedger ledger;

    @Test
    void secondRunningEntryForSameSourceIsRejected() {
        ledger.open("wire", CrawlTrigger.SCHEDULED);

        assertThatThrownBy(() -> ledger.open("wire", CrawlTrigger.MANUAL))
                .isInstanceOf(CrawlAlreadyRunningException.class);
        assertThat(crawlRunRepository.count()).isEqualTo(1);
    }

    @Test
    void otherSourcesMayRunConcurrently() {
        ledger.open("wire", CrawlTrigger.SCHEDULED);
        ledger.open("daily", CrawlTrigger.SCHEDULED);

        assertThat(ledger.runningSourceNames()).containsExactly("daily", "wire");
    }

    @Test
    void finishedRunFreesTheSource() {
        CrawlRun first = ledger.open("wire", CrawlTrigger.SCHEDULED);
        ledger.complete(first.getId(), 0, 0, 0, List.of());

        CrawlRun second = ledger.open("wire", CrawlTrigger.MANUAL);

        assertThat(second.getStatus()).isEqualTo(CrawlRunStatus.RUNNING);
        assertThat(ledger.isRunning("wire")).isTrue();
        assertThat(ledger.get(first.getId()).getStatus()).isEqualTo(CrawlRunStatus.COMPLETED);
    }

    @Test
    void staleRunsAreFailedAndFreeTheSource() {
        crawlRunRepository.saveAndFlush(new CrawlRun("wire", CrawlTrigger.SCHEDULED,
                Instant.now().minus(Duration.ofHours(3))));
        crawlRunRepository.saveAndFlush(new CrawlRun("daily", CrawlTrigger.SCHEDULED,
                Instant.now()));

        List<CrawlRun> failed = ledger.failStaleRuns(Duration.ofMinutes(30), Set.of());

        assertThat(failed).extracting(CrawlRun::getSourceName).containsExactly("wire");
        assertThat(ledger.runningSourceNames()).containsExactly("daily");
        assertThat(ledger.open("wire", CrawlTrigger.SCHEDULED).getStatus())
                .isEqualTo(CrawlRunStatus.RUNNING);
    }

    @Test
    void heartbeatKeepsLongRunningEntryOutOfTheSweep() {
        CrawlRun longRunning = crawlRunRepository.saveAndFlush(new CrawlRun("wire",
                CrawlTrigger.SCHEDULED, Instant.now().minus(Duration.ofHours(3))));

        assertThat(ledger.heartbeat(Set.of(longRunning.getId()))).isEqualTo(1);
        List<CrawlRun> failed = ledger.failStaleRuns(Duration.ofMinutes(30), Set.of());

        assertThat(failed).isEmpty();
        assertThat(ledger.get(longRunning.getId()).getLastHeartbeatAt())
                .isAfter(Instant.now().minus(Duration.ofMinutes(1)));
        assertThat(ledger.isRunning("wire")).isTrue();
    }

    @Test
    void heartbeatIgnoresFinishedRuns() {
        CrawlRun run = ledger.open("wire", CrawlTrigger.MANUAL);
        ledger.complete(run.getId(), 0, 0, 0, List.of());

        assertThat(ledger.heartbeat(Set.of(run.getId()))).isZero();
    }
}
