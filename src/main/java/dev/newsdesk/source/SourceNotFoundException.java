package dev.newsdesk.source;

/** No source is configured under the requested name. */
public class SourceNotFoundException extends RuntimeException {

  public SourceNotFoundException(String name) {
    super("Source not found: " + name);
  }
}
