package dev.newsdesk;

import static org.assertj.core.api.Assertions.assertThat;

import dev.newsdesk.adapter.SourceAdapterRegistry;
import dev.newsdesk.schedule.LiveRunHeartbeat;
import dev.newsdesk.schedule.ScheduledCrawlJobs;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;

class ApplicationSmokeIT extends BaseIntegrationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SourceAdapterRegistry adapterRegistry;

    @Test
    void contextLoads() {
        // Reaching this point means Flyway migrated the schema and Hibernate validated every
        // entity against it.
        assertThat(adapterRegistry.keys()).contains("rss", "sitemap");
    }

    @Test
    void schedulerIsOffWhenDisabled() {
        assertThat(context.getBeansOfType(ScheduledCrawlJobs.class)).isEmpty();
        assertThat(context.getBeansOfType(LiveRunHeartbeat.class)).hasSize(1);
    }
}
