package dev.newsdesk.run;

/** The crawl worker pool did not accept a run, usually because its queue is full. */
public class DispatchRejectedException extends RuntimeException {

    public DispatchRejectedException(String sourceName, Throwable cause) {
        super("Crawl of source '" + sourceName + "' was not accepted: " + cause.getMessage(), cause);
    }
}
