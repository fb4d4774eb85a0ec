package dev.newsdesk.schedule;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the crawl scheduler, bound from {@code newsdesk.scheduler.*}.
 *
 * <ul>
 *   <li>{@code tick-interval-ms} - delay between ticks (default 60000)
 *   <li>{@code initial-delay-ms} - delay before the first tick and the first sweep (default 10000)
 *   <li>{@code stale-sweep-interval-ms} - delay between stale-run sweeps (default 300000)
 *   <li>{@code stale-run-threshold-minutes} - heartbeat age after which a running entry is failed
 *       (default 30)
 *   <li>{@code heartbeat-interval-ms} - delay between heartbeats of live runs (default 60000); at
 *       most half the stale-run threshold
 * </ul>
 *
 * <p>{@code newsdesk.scheduler.enabled} is read by the condition on {@link ScheduledCrawlJobs}
 * and is not bound here. Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "newsdesk.scheduler")
public class SchedulerProperties {

  private long tickIntervalMs = 60_000;
  private long initialDelayMs = 10_000;
  private long staleSweepIntervalMs = 300_000;
  private int staleRunThresholdMinutes = 30;
  private long heartbeatIntervalMs = 60_000;

  /** Throws if values are out of range. */
  @PostConstruct
  void validate() {
    if (tickIntervalMs < 1_000) {
      throw new IllegalStateException(
          "newsdesk.scheduler.tick-interval-ms must be >= 1000, got: " + tickIntervalMs);
    }
    if (initialDelayMs < 0) {
      throw new IllegalStateException(
          "newsdesk.scheduler.initial-delay-ms must be >= 0, got: " + initialDelayMs);
    }
    if (staleSweepIntervalMs < 1_000) {
      throw new IllegalStateException(
          "newsdesk.scheduler.stale-sweep-interval-ms must be >= 1000, got: "
              + staleSweepIntervalMs);
    }
    if (staleRunThresholdMinutes < 1) {
      throw new IllegalStateException(
          "newsdesk.scheduler.stale-run-threshold-minutes must be >= 1, got: "
              + staleRunThresholdMinutes);
    }
    if (heartbeatIntervalMs < 1_000) {
      throw new IllegalStateException(
          "newsdesk.scheduler.heartbeat-interval-ms must be >= 1000, got: "
              + heartbeatIntervalMs);
    }
    long thresholdMs = staleRunThresholdMinutes * 60_000L;
    if (heartbeatIntervalMs * 2 > thresholdMs) {
      throw new IllegalStateException(
          "newsdesk.scheduler.heartbeat-interval-ms must be at most half of "
              + "stale-run-threshold-minutes (" + thresholdMs + " ms), got: "
              + heartbeatIntervalMs);
    }
  }

  public long getTickIntervalMs() {
    return tickIntervalMs;
  }

  public void setTickIntervalMs(long tickIntervalMs) {
    this.tickIntervalMs = tickIntervalMs;
  }

  public long getInitialDelayMs() {
    return initialDelayMs;
  }

  public void setInitialDelayMs(long initialDelayMs) {
    this.initialDelayMs = initialDelayMs;
  }

  public long getStaleSweepIntervalMs() {
    return staleSweepIntervalMs;
  }

  public void setStaleSweepIntervalMs(long staleSweepIntervalMs) {
    this.staleSweepIntervalMs = staleSweepIntervalMs;
  }

  public int getStaleRunThresholdMinutes() {
    return staleRunThresholdMinutes;
  }

  public void setStaleRunThresholdMinutes(int staleRunThresholdMinutes) {
    this.staleRunThresholdMinutes = staleRunThresholdMinutes;
  }

  public long getHeartbeatIntervalMs() {
    return heartbeatIntervalMs;
  }

  public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
    this.heartbeatIntervalMs = heartbeatIntervalMs;
  }
}
