package com.activity.resolution.tracing;

/**
 * A traced unit of work, usually one batch run.
 * Ends when closed, so it fits try-with-resources:
 *
 * <pre>
 * try (Span span = tracing.startRun("backfill-timezones", runId)) {
 *     span.setAttribute("activities", candidates.size());
 *     span.setOutcome(Span.Outcome.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    /**
     * Records a point-in-time event such as a skipped row.
     */
    void addEvent(String name);

    void setOutcome(Outcome outcome);

    void recordException(Throwable t);

    @Override
    void close();

    enum Outcome { OK, ERROR }
}
