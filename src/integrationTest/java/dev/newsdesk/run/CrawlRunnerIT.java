package dev.newsdesk.run;

import static org.assertj.core.api.Assertions.assertThat;

import dev.newsdesk.BaseIntegrationTest;
import dev.newsdesk.adapter.CrawlTarget;
import dev.newsdesk.adapter.ItemData;
import dev.newsdesk.adapter.SourceAdapter;
import dev.newsdesk.ledger.CrawlRun;
import dev.newsdesk.ledger.CrawlRunStatus;
import dev.newsdesk.ledger.CrawlTrigger;
import dev.newsdesk.source.Source;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Runs whole crawls against the real ledger, dedup gate and source table, with an in-memory
 * adapter standing in for the network.
 */
class CrawlRunnerIT extends BaseIntegrationTest {

    static final String ADAPTER_KEY = "static-fixture";

    @TestConfiguration
    static class FixtureAdapterConfig {

        @Bean
        SourceAdapter staticFixtureAdapter() {
            return new SourceAdapter() {
                @Override
                public String key() {
                    return ADAPTER_KEY;
                }

                @Override
                public List<String> listCandidates(CrawlTarget target, @Nullable Integer limit) {
                    if (target.setting("failDiscovery") != null) {
                        throw new IllegalStateException("listing unavailable");
                    }
                    return IntStream.range(0, target.intSetting("candidates", 10))
                            .mapToObj(i -> target.baseUrl() + "/story/" + i)
                            .toList();
                }

                @Override
                public Optional<ItemData> parseItem(CrawlTarget target, String identifier) {
                    if (identifier.endsWith("/7") || identifier.endsWith("/8")
                            || identifier.endsWith("/9")) {
                        return Optional.empty();
                    }
                    return Optional.of(new ItemData("Title " + identifier, "Body " + identifier,
                            Map.of("author", "Fixture")));
                }
            };
        }
    }

    @Autowired
    CrawlRunner crawlRunner;

    private Source source(String name, Map<String, Object> settings) {
        Source source = new Source(name, "https://" + name + ".example.com", 15);
        source.setSettings(settings);
        return sourceRepository.saveAndFlush(source);
    }

    @Test
    void crawlStoresNewItemsAndSkipsKnownOnes() {
        source("fixture", Map.of("adapter", ADAPTER_KEY));
        crawlRunner.run("fixture", null, CrawlTrigger.SCHEDULED);

        CrawlRunOutcome second = crawlRunner.run("fixture", null, CrawlTrigger.SCHEDULED);

        assertThat(second.status()).isEqualTo(CrawlRunStatus.COMPLETED);
        assertThat(second.itemsFound()).isEqualTo(7);
        assertThat(second.itemsSaved()).isZero();
        assertThat(second.itemsSkipped()).isEqualTo(7);
        assertThat(itemRecordRepository.countBySourceName("fixture")).isEqualTo(7);
    }

    @Test
    void firstCrawlIsRecordedInLedgerAndMarkers() {
        source("fixture", Map.of("adapter", ADAPTER_KEY));

        CrawlRunOutcome outcome = crawlRunner.run("fixture", null, CrawlTrigger.SCHEDULED);

        CrawlRun run = crawlRunRepository.findById(outcome.runId()).orElseThrow();
        assertThat(run.getStatus()).isEqualTo(CrawlRunStatus.COMPLETED);
        assertThat(run.getItemsFound()).isEqualTo(7);
        assertThat(run.getItemsSaved()).isEqualTo(7);
        assertThat(run.getSavedItemIds()).hasSize(7);
        assertThat(run.getEndedAt()).isNotNull();
        Source updated = sourceRepository.findByName("fixture").orElseThrow();
        assertThat(updated.getLastCrawlAt()).isNotNull();
        assertThat(updated.getLastScheduledCrawlAt()).isEqualTo(updated.getLastCrawlAt());
    }

    @Test
    void failedDiscoveryIsRecordedAndStillAdvancesMarkers() {
        source("broken", Map.of("adapter", ADAPTER_KEY, "failDiscovery", "yes"));

        CrawlRunOutcome outcome = crawlRunner.run("broken", null, CrawlTrigger.MANUAL);

        CrawlRun run = crawlRunRepository.findById(outcome.runId()).orElseThrow();
        assertThat(run.getStatus()).isEqualTo(CrawlRunStatus.FAILED);
        assertThat(run.getErrorMessage()).contains("listing unavailable");
        Source updated = sourceRepository.findByName("broken").orElseThrow();
        assertThat(updated.getLastCrawlAt()).isNotNull();
        assertThat(updated.getLastScheduledCrawlAt()).isNull();
    }
}
