package dev.newsdesk.fetch;

/**
 * Transient fetch failure: timeout, connection error or a non-404 error status. Retried by
 * {@link Fetcher} and propagated once the attempts are exhausted.
 */
public class FetchException extends RuntimeException {

  private final String url;

  public FetchException(String url, Throwable cause) {
    super("Failed to fetch " + url + ": " + cause.getMessage(), cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
