package dev.newsdesk.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on {@code @Scheduled} processing. Always on: the live-run heartbeat must run even when
 * {@code newsdesk.scheduler.enabled=false} switches off the crawl tick.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {}
