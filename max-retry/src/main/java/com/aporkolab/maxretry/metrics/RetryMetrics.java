package com.aporkolab.maxretry.metrics;

/**
 * Instrumentation used by the handler and consumer. Passed in explicitly at construction.
 * 
 * Implementations must not throw on recording problems; they report them through
 * {@link MetricsResult} (and their own logging).
 */
public interface RetryMetrics {

    /**
     * Bump a counter by one.
     */
    MetricsResult increment(String metric);

    /**
     * Run {@code block} and record how long it took. The block always runs;
     * anything it throws reaches the caller.
     */
    MetricsResult timing(String metric, Runnable block);

    static RetryMetrics noop() {
        return NoOpRetryMetrics.INSTANCE;
    }
}
