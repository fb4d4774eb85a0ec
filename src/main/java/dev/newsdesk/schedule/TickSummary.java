package dev.newsdesk.schedule;

import java.util.List;

/**
 * Result of one scheduler tick.
 *
 * @param checked   active sources evaluated
 * @param triggered sources a run was dispatched for
 * @param failed    sources whose evaluation or dispatch failed
 */
public record TickSummary(int checked, List<String> triggered, List<String> failed) {

    public TickSummary {
        triggered = List.copyOf(triggered);
        failed = List.copyOf(failed);
    }

    public static TickSummary empty() {
        return new TickSummary(0, List.of(), List.of());
    }
}
