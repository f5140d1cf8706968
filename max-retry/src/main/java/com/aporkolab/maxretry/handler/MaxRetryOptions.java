package com.aporkolab.maxretry.handler;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.aporkolab.maxretry.exception.InvalidConfigurationException;

/**
 * Configuration of a {@link MaxRetryHandler}.
 * 
 * Defaults:
 * <pre>
 * retry_exchange          &lt;queue&gt;-retry           (exchange and queue)
 * retry_error_exchange    &lt;queue&gt;-error           (exchange and queue)
 * retry_requeue_exchange  &lt;queue&gt;-retry-requeue   (exchange)
 * retry_timeout           60000 ms
 * retry_max_times         5
 * durable                 true
 * death count strategy    RECORDS
 * </pre>
 * 
 * Instances are immutable; names are resolved against a worker queue with
 * {@link #resolveNames(String)}.
 * 
 * Warning: RabbitMQ 3.x and later keep a single {@code x-death} entry per queue and
 * reason and increment its {@code count} instead of appending entries. Under the default
 * {@link DeathCountStrategy#RECORDS} such a history never counts more than one failure, so
 * with {@code maxRetries > 1} a failing message is retried forever. Use
 * {@link DeathCountStrategy#COUNT_FIELD} on those brokers.
 */
public final class MaxRetryOptions {

    public static final String RETRY_SUFFIX = "-retry";
    public static final String ERROR_SUFFIX = "-error";
    public static final String REQUEUE_SUFFIX = "-retry-requeue";

    public static final Duration DEFAULT_RETRY_TIMEOUT = Duration.ofMillis(60_000);
    public static final int DEFAULT_MAX_RETRIES = 5;

    public static final String DEAD_LETTER_EXCHANGE_ARGUMENT = "x-dead-letter-exchange";
    public static final String MESSAGE_TTL_ARGUMENT = "x-message-ttl";

    private final String retryExchange;
    private final String errorExchange;
    private final String requeueExchange;
    private final Duration retryTimeout;
    private final int maxRetries;
    private final boolean durable;
    private final DeathCountStrategy deathCountStrategy;

    private MaxRetryOptions(Builder builder) {
        this.retryExchange = builder.retryExchange;
        this.errorExchange = builder.errorExchange;
        this.requeueExchange = builder.requeueExchange;
        this.retryTimeout = builder.retryTimeout;
        this.maxRetries = builder.maxRetries;
        this.durable = builder.durable;
        this.deathCountStrategy = builder.deathCountStrategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MaxRetryOptions defaults() {
        return builder().build();
    }

    /**
     * Resolve the topology names for a worker queue, applying overrides.
     *
     * @throws InvalidConfigurationException if the queue name is blank or two entities would share a name
     */
    public TopologyNames resolveNames(String workerQueue) {
        if (workerQueue == null || workerQueue.isBlank()) {
            throw new InvalidConfigurationException("queue", "worker queue name must not be blank");
        }

        TopologyNames names = new TopologyNames(
                workerQueue,
                retryExchange != null ? retryExchange : workerQueue + RETRY_SUFFIX,
                errorExchange != null ? errorExchange : workerQueue + ERROR_SUFFIX,
                requeueExchange != null ? requeueExchange : workerQueue + REQUEUE_SUFFIX
        );

        // retry and error double as queue names, so they must not collide with the worker queue either
        Set<String> taken = new HashSet<>();
        taken.add(workerQueue);
        claim(taken, "retry_exchange", names.retryExchange());
        claim(taken, "retry_error_exchange", names.errorExchange());
        claim(taken, "retry_requeue_exchange", names.requeueExchange());
        return names;
    }

    /**
     * Arguments of the retry queue: expired messages dead-letter onto the requeue exchange.
     */
    public Map<String, Object> retryQueueArguments(TopologyNames names) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(DEAD_LETTER_EXCHANGE_ARGUMENT, names.requeueExchange());
        arguments.put(MESSAGE_TTL_ARGUMENT, retryTimeout.toMillis());
        return arguments;
    }

    /**
     * Arguments the worker queue must be declared with so that plain rejections
     * are dead-lettered into the retry exchange.
     */
    public Map<String, Object> workerQueueArguments(String workerQueue) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(DEAD_LETTER_EXCHANGE_ARGUMENT, resolveNames(workerQueue).retryExchange());
        return arguments;
    }

    public String getRetryExchange() {
        return retryExchange;
    }

    public String getErrorExchange() {
        return errorExchange;
    }

    public String getRequeueExchange() {
        return requeueExchange;
    }

    public Duration getRetryTimeout() {
        return retryTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isDurable() {
        return durable;
    }

    public DeathCountStrategy getDeathCountStrategy() {
        return deathCountStrategy;
    }

    @Override
    public String toString() {
        return "MaxRetryOptions{retryExchange=" + retryExchange
                + ", errorExchange=" + errorExchange
                + ", requeueExchange=" + requeueExchange
                + ", retryTimeout=" + retryTimeout.toMillis() + "ms"
                + ", maxRetries=" + maxRetries
                + ", durable=" + durable
                + ", deathCountStrategy=" + deathCountStrategy + '}';
    }

    private static void claim(Set<String> taken, String option, String name) {
        if (!taken.add(name)) {
            throw InvalidConfigurationException.nameClash(option, name);
        }
    }

    public static class Builder {
        private String retryExchange;
        private String errorExchange;
        private String requeueExchange;
        private Duration retryTimeout = DEFAULT_RETRY_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private boolean durable = true;
        private DeathCountStrategy deathCountStrategy = DeathCountStrategy.RECORDS;

        /** Overrides the retry exchange and queue name; null keeps the default. */
        public Builder retryExchange(String retryExchange) {
            this.retryExchange = retryExchange;
            return this;
        }

        /** Overrides the error exchange and queue name; null keeps the default. */
        public Builder errorExchange(String errorExchange) {
            this.errorExchange = errorExchange;
            return this;
        }

        /** Overrides the requeue exchange name; null keeps the default. */
        public Builder requeueExchange(String requeueExchange) {
            this.requeueExchange = requeueExchange;
            return this;
        }

        public Builder retryTimeout(Duration retryTimeout) {
            this.retryTimeout = retryTimeout;
            return this;
        }

        public Builder retryTimeoutMs(long retryTimeoutMs) {
            return retryTimeout(Duration.ofMillis(retryTimeoutMs));
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        /**
         * How prior failures are read from {@code x-death}. Pick {@link DeathCountStrategy#COUNT_FIELD}
         * for brokers that collapse the history per queue and reason (RabbitMQ 3.x and later);
         * the default {@link DeathCountStrategy#RECORDS} never exhausts retries there.
         */
        public Builder deathCountStrategy(DeathCountStrategy deathCountStrategy) {
            this.deathCountStrategy = deathCountStrategy;
            return this;
        }

        /**
         * @throws InvalidConfigurationException on a non-positive timeout, negative retries or blank overrides
         */
        public MaxRetryOptions build() {
            // the TTL is declared in whole milliseconds
            if (retryTimeout == null || retryTimeout.toMillis() < 1) {
                throw new InvalidConfigurationException("retry_timeout", "must be at least 1 ms, was " + retryTimeout);
            }
            if (maxRetries < 0) {
                throw new InvalidConfigurationException("retry_max_times", "must not be negative, was " + maxRetries);
            }
            if (deathCountStrategy == null) {
                throw new InvalidConfigurationException("death_count_strategy", "must not be null");
            }
            requireNotBlank("retry_exchange", retryExchange);
            requireNotBlank("retry_error_exchange", errorExchange);
            requireNotBlank("retry_requeue_exchange", requeueExchange);
            return new MaxRetryOptions(this);
        }

        private static void requireNotBlank(String option, String value) {
            if (value != null && value.isBlank()) {
                throw new InvalidConfigurationException(option, "must not be blank when set");
            }
        }
    }
}
