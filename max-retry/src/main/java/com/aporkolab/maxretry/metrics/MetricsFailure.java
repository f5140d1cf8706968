package com.aporkolab.maxretry.metrics;

/**
 * Why a metric could not be recorded.
 */
public enum MetricsFailure {

    /** Metric name blank, or rejected by the backend as malformed or conflicting */
    INVALID_METRIC,

    /** Backend already closed; nothing more will be published */
    REGISTRY_CLOSED,

    /** Backend refused the write in its current state */
    REGISTRY_REJECTED
}
