package com.aporkolab.maxretry.metrics;

import java.util.Optional;

/**
 * Outcome of one metrics call. Failures are reported here instead of being thrown,
 * so instrumentation can never change how a delivery is disposed of.
 */
public record MetricsResult(String metric, MetricsFailure failure, String detail) {

    public static MetricsResult recorded(String metric) {
        return new MetricsResult(metric, null, null);
    }

    public static MetricsResult failed(String metric, MetricsFailure failure, String detail) {
        return new MetricsResult(metric, failure, detail);
    }

    public boolean isRecorded() {
        return failure == null;
    }

    public Optional<MetricsFailure> getFailure() {
        return Optional.ofNullable(failure);
    }
}
