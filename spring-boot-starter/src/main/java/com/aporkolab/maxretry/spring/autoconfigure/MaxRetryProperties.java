package com.aporkolab.maxretry.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.aporkolab.maxretry.handler.DeathCountStrategy;
import com.aporkolab.maxretry.handler.MaxRetryOptions;
import com.aporkolab.maxretry.metrics.micrometer.MicrometerRetryMetrics;

/**
 * Configuration properties for the max-retry handler.
 * 
 * Example application.yml:
 * <pre>
 * max-retry:
 *   enabled: true
 *   retry-timeout-ms: 30000
 *   retry-max-times: 3
 *   durable: true
 *   death-count-strategy: COUNT_FIELD
 *   metrics:
 *     enabled: true
 *     prefix: maxretry
 * </pre>
 * 
 * Exchange names left unset derive from the worker queue name when a handler is created.
 * 
 * Warning: death-count-strategy defaults to RECORDS. RabbitMQ 3.x and later collapse the
 * x-death history into one entry per queue and reason, which RECORDS counts as a single
 * failure, so messages are retried forever once retry-max-times is above 1. Set
 * death-count-strategy to COUNT_FIELD on those brokers.
 */
@ConfigurationProperties(prefix = "max-retry")
public class MaxRetryProperties {

    private boolean enabled = true;
    private String retryExchange;
    private String retryErrorExchange;
    private String retryRequeueExchange;
    private long retryTimeoutMs = MaxRetryOptions.DEFAULT_RETRY_TIMEOUT.toMillis();
    private int retryMaxTimes = MaxRetryOptions.DEFAULT_MAX_RETRIES;
    private boolean durable = true;
    private DeathCountStrategy deathCountStrategy = DeathCountStrategy.RECORDS;
    private MetricsProperties metrics = new MetricsProperties();

    /**
     * @throws com.aporkolab.maxretry.exception.InvalidConfigurationException when the bound values are invalid
     */
    public MaxRetryOptions toOptions() {
        return MaxRetryOptions.builder()
                .retryExchange(retryExchange)
                .errorExchange(retryErrorExchange)
                .requeueExchange(retryRequeueExchange)
                .retryTimeoutMs(retryTimeoutMs)
                .maxRetries(retryMaxTimes)
                .durable(durable)
                .deathCountStrategy(deathCountStrategy)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRetryExchange() {
        return retryExchange;
    }

    public void setRetryExchange(String retryExchange) {
        this.retryExchange = retryExchange;
    }

    public String getRetryErrorExchange() {
        return retryErrorExchange;
    }

    public void setRetryErrorExchange(String retryErrorExchange) {
        this.retryErrorExchange = retryErrorExchange;
    }

    public String getRetryRequeueExchange() {
        return retryRequeueExchange;
    }

    public void setRetryRequeueExchange(String retryRequeueExchange) {
        this.retryRequeueExchange = retryRequeueExchange;
    }

    public long getRetryTimeoutMs() {
        return retryTimeoutMs;
    }

    public void setRetryTimeoutMs(long retryTimeoutMs) {
        this.retryTimeoutMs = retryTimeoutMs;
    }

    public int getRetryMaxTimes() {
        return retryMaxTimes;
    }

    public void setRetryMaxTimes(int retryMaxTimes) {
        this.retryMaxTimes = retryMaxTimes;
    }

    public boolean isDurable() {
        return durable;
    }

    public void setDurable(boolean durable) {
        this.durable = durable;
    }

    public DeathCountStrategy getDeathCountStrategy() {
        return deathCountStrategy;
    }

    public void setDeathCountStrategy(DeathCountStrategy deathCountStrategy) {
        this.deathCountStrategy = deathCountStrategy;
    }

    public MetricsProperties getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsProperties metrics) {
        this.metrics = metrics;
    }

    public static class MetricsProperties {
        private boolean enabled = true;
        private String prefix = MicrometerRetryMetrics.DEFAULT_PREFIX;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }
    }
}
