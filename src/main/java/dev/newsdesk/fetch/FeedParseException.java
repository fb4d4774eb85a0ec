package dev.newsdesk.fetch;

/** The document at a feed address was retrieved but is not a readable RSS/Atom feed. */
public class FeedParseException extends RuntimeException {

  public FeedParseException(String url, Throwable cause) {
    super("Unreadable feed at " + url + ": " + cause.getMessage(), cause);
  }
}
