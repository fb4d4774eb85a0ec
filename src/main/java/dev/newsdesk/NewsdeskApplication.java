package dev.newsdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Newsdesk crawler.
 *
 * <p>Runs the periodic crawl scheduler (unless {@code newsdesk.scheduler.enabled=false}) and a
 * small REST surface for source configuration, manual crawls and result queries.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NewsdeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(NewsdeskApplication.class, args);
    }
}
