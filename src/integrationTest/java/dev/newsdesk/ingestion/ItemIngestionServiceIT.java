package dev.newsdesk.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import dev.newsdesk.BaseIntegrationTest;
import dev.newsdesk.crawl.ContentHasher;
import dev.newsdesk.crawl.CrawledItem;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ItemIngestionServiceIT extends BaseIntegrationTest {

    @Autowired
    ItemIngestionService ingestionService;

    private static CrawledItem item(String url) {
        return new CrawledItem("wire", url, ContentHasher.forIdentifier(url), "Title of " + url,
                "Body of " + url, Map.of("author", "Desk"));
    }

    @Test
    void committingTheSameBatchTwiceStoresItOnce() {
        List<CrawledItem> batch = List.of(item("https://wire.example.com/a"),
                item("https://wire.example.com/b"));

        CommitResult first = ingestionService.commit(batch);
        CommitResult second = ingestionService.commit(batch);

        assertThat(first.saved()).isEqualTo(2);
        assertThat(first.savedIds()).hasSize(2);
        assertThat(second.saved()).isZero();
        assertThat(second.skipped()).isEqualTo(2);
        assertThat(itemRecordRepository.countBySourceName("wire")).isEqualTo(2);
    }

    @Test
    void duplicateInsideOneBatchIsSkipped() {
        CrawledItem story = item("https://wire.example.com/a");

        CommitResult result = ingestionService.commit(List.of(story, story));

        assertThat(result.saved()).isEqualTo(1);
        assertThat(result.skipped()).isEqualTo(1);
    }

    @Test
    void alreadyStoredItemIsSkipped() {
        CrawledItem story = item("https://wire.example.com/known");
        itemRecordRepository.saveAndFlush(ItemRecord.from(story));

        CommitResult result = ingestionService.commit(List.of(story));

        assertThat(result.skipped()).isEqualTo(1);
        assertThat(itemRecordRepository.count()).isEqualTo(1);
    }
}
