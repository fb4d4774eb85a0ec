package dev.newsdesk;

import static org.assertj.core.api.Assertions.assertThat;

import dev.newsdesk.crawl.CrawledItem;
import dev.newsdesk.ingestion.ItemRecord;
import dev.newsdesk.ledger.CrawlRun;
import dev.newsdesk.ledger.CrawlRunStatus;
import dev.newsdesk.ledger.CrawlTrigger;
import dev.newsdesk.source.Source;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/**
 * Compensates for ddl-auto=validate only checking column presence by persisting and reading back
 * each entity against the Flyway schema, JSONB columns included.
 */
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Test
    void sourceRoundtripsWithSettings() {
        Source source = new Source("drift-source", "https://drift.example.com", 20);
        source.setSettings(Map.of("adapter", "rss", "minBodyLength", 50));
        Instant crawled = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        source.recordCrawl(crawled, true);

        Source saved = sourceRepository.saveAndFlush(source);
        Source found = sourceRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getName()).isEqualTo("drift-source");
        assertThat(found.getCrawlIntervalMinutes()).isEqualTo(20);
        assertThat(found.getSettings()).containsEntry("adapter", "rss")
                .containsEntry("minBodyLength", 50);
        assertThat(found.getLastScheduledCrawlAt()).isEqualTo(crawled);
        assertThat(found.getCreatedAt()).isNotNull();
        assertThat(found.getUpdatedAt()).isNotNull();
    }

    @Test
    void crawlRunRoundtripsWithSavedIds() {
        Instant started = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        CrawlRun run = new CrawlRun("drift-source", CrawlTrigger.MANUAL, started);
        UUID itemId = UUID.randomUUID();
        run.markCompleted(started.plusSeconds(4), 3, 1, 2, List.of(itemId));

        CrawlRun saved = crawlRunRepository.saveAndFlush(run);
        CrawlRun found = crawlRunRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getStatus()).isEqualTo(CrawlRunStatus.COMPLETED);
        assertThat(found.getTrigger()).isEqualTo(CrawlTrigger.MANUAL);
        assertThat(found.getSavedItemIds()).containsExactly(itemId.toString());
        assertThat(found.getDurationMs()).isEqualTo(4_000L);
    }

    @Test
    void itemRecordRoundtripsWithMetadata() {
        ItemRecord item = ItemRecord.from(new CrawledItem("drift-source",
                "https://drift.example.com/story", "c0ffee", "Title", "Body text",
                Map.of("author", "Desk", "category", "World")));

        ItemRecord saved = itemRecordRepository.saveAndFlush(item);
        ItemRecord found = itemRecordRepository.findById(saved.getId()).orElseThrow();

        assertThat(found.getMetadata()).containsEntry("author", "Desk");
        assertThat(found.getRetrievedAt()).isNotNull();
        assertThat(found.isProcessed()).isFalse();
    }
}
