package dev.newsdesk.crawl;

/** The thread driving a crawl was interrupted while waiting for item work. */
public class CrawlInterruptedException extends RuntimeException {

  public CrawlInterruptedException(String sourceName, InterruptedException cause) {
    super("Crawl of source '" + sourceName + "' was interrupted", cause);
  }
}
