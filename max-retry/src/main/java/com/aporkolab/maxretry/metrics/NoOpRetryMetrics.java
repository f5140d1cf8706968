package com.aporkolab.maxretry.metrics;

/**
 * Records nothing; {@code timing} still runs its block.
 */
enum NoOpRetryMetrics implements RetryMetrics {

    INSTANCE;

    @Override
    public MetricsResult increment(String metric) {
        return MetricsResult.recorded(metric);
    }

    @Override
    public MetricsResult timing(String metric, Runnable block) {
        block.run();
        return MetricsResult.recorded(metric);
    }
}
