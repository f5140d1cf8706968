package com.aporkolab.maxretry.metrics.micrometer;

import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.maxretry.metrics.MetricsFailure;
import com.aporkolab.maxretry.metrics.MetricsResult;
import com.aporkolab.maxretry.metrics.RetryMetrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer-backed {@link RetryMetrics}.
 * 
 * Metric names are {@code <prefix>.<metric>}, e.g. with the default prefix:
 * - maxretry.orders.ack / .retry / .requeue / .dead_letter / .noop (counters, from the handler)
 * - maxretry.orders.started (counter, from the consumer)
 * - maxretry.orders.time (timer, from the consumer)
 * 
 * Dots are Micrometer's canonical separator; each registry renders them in its backend's
 * convention (e.g. {@code maxretry_orders_ack_total} in Prometheus).
 * 
 * Recording problems the registry signals with {@link IllegalArgumentException} or
 * {@link IllegalStateException}, and a closed registry, are logged and returned as a
 * failed {@link MetricsResult}. Anything else is a bug and propagates.
 */
public class MicrometerRetryMetrics implements RetryMetrics {

    private static final Logger log = LoggerFactory.getLogger(MicrometerRetryMetrics.class);

    public static final String DEFAULT_PREFIX = "maxretry";

    private final MeterRegistry registry;
    private final String prefix;
    private final Tags baseTags;

    public MicrometerRetryMetrics(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    public MicrometerRetryMetrics(MeterRegistry registry, String prefix) {
        this(registry, prefix, Tags.empty());
    }

    public MicrometerRetryMetrics(MeterRegistry registry, String prefix, Tags tags) {
        this.registry = registry;
        this.prefix = prefix == null ? "" : prefix.trim();
        this.baseTags = tags;
    }

    @Override
    public MetricsResult increment(String metric) {
        return record(metric, name -> Counter.builder(name)
                .description("Max-retry handler events")
                .tags(baseTags)
                .register(registry)
                .increment());
    }

    @Override
    public MetricsResult timing(String metric, Runnable block) {
        Clock clock = registry.config().clock();
        long start = clock.monotonicTime();

        MetricsResult result;
        try {
            block.run();
        } finally {
            long elapsed = clock.monotonicTime() - start;
            result = record(metric, name -> Timer.builder(name)
                    .description("Max-retry delivery processing time")
                    .tags(baseTags)
                    .publishPercentiles(0.5, 0.95, 0.99)
                    .register(registry)
                    .record(elapsed, TimeUnit.NANOSECONDS));
        }
        return result;
    }

    public String getPrefix() {
        return prefix;
    }

    private MetricsResult record(String metric, Consumer<String> write) {
        if (metric == null || metric.isBlank()) {
            return failed(metric, MetricsFailure.INVALID_METRIC, "metric name must not be blank");
        }
        String name = prefix.isEmpty() ? metric : prefix + "." + metric;

        if (registry.isClosed()) {
            return failed(name, MetricsFailure.REGISTRY_CLOSED, "meter registry is closed");
        }

        try {
            write.accept(name);
            return MetricsResult.recorded(name);
        } catch (IllegalArgumentException e) {
            return failed(name, MetricsFailure.INVALID_METRIC, e.getMessage());
        } catch (IllegalStateException e) {
            return failed(name, MetricsFailure.REGISTRY_REJECTED, e.getMessage());
        }
    }

    private static MetricsResult failed(String name, MetricsFailure failure, String detail) {
        log.warn("Could not record metric {}: {} ({})", name, failure, detail);
        return MetricsResult.failed(name, failure, detail);
    }
}
