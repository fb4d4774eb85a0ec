package dev.newsdesk.source;

/** A source with the same name is already configured. */
public class DuplicateSourceException extends RuntimeException {

  public DuplicateSourceException(String name) {
    super("Source already exists: " + name);
  }
}
