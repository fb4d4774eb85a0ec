package dev.newsdesk.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import dev.newsdesk.crawl.CrawlProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for crawl execution.
 *
 * <ul>
 *   <li>{@code crawlRunExecutor} - one task per dispatched crawl run
 *   <li>{@code itemFetchExecutor} - item fetch and parse tasks, shared by all runs; each run
 *       bounds its own share with a semaphore
 * </ul>
 *
 * <p>A full queue rejects the task with {@link RejectedExecutionException}, which the submitter
 * handles.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Bean(name = "crawlRunExecutor")
    public Executor crawlRunExecutor(CrawlProperties properties) {
        return executor("crawl-run-", properties.runPoolSize(), properties.queueCapacity());
    }

    @Bean(name = "itemFetchExecutor")
    public Executor itemFetchExecutor(CrawlProperties properties) {
        return executor("item-fetch-", properties.itemPoolSize(), properties.queueCapacity());
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler((task, pool) -> {
            log.warn("Task rejected from {}* pool ({} active, queue full)", prefix,
                    pool.getActiveCount());
            throw new RejectedExecutionException("Pool " + prefix + "* is saturated");
        });
        executor.initialize();
        return executor;
    }
}
