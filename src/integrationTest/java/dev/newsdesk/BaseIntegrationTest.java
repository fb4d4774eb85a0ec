package dev.newsdesk;

import dev.newsdesk.ingestion.ItemRecordRepository;
import dev.newsdesk.ledger.CrawlRunRepository;
import dev.newsdesk.source.SourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance, migrated by Flyway on context start,
 * and empties every table before each test. The periodic scheduler is disabled so ticks never race
 * the test body.
 */
@SpringBootTest(properties = "newsdesk.scheduler.enabled=false")
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  static {
    postgres.start();
  }

  @Autowired protected SourceRepository sourceRepository;

  @Autowired protected CrawlRunRepository crawlRunRepository;

  @Autowired protected ItemRecordRepository itemRecordRepository;

  @BeforeEach
  void cleanTables() {
    itemRecordRepository.deleteAllInBatch();
    crawlRunRepository.deleteAllInBatch();
    sourceRepository.deleteAllInBatch();
  }
}
