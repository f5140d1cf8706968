package com.aporkolab.maxretry.handler;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.maxretry.exception.BrokerOperationException;
import com.aporkolab.maxretry.logging.DeliveryContext;
import com.aporkolab.maxretry.metrics.RetryMetrics;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;

/**
 * Retries failed deliveries through broker dead-lettering and parks them on an error queue
 * once they have failed too often.
 * 
 * Constructing the handler declares the retry topology (see {@link RetryTopology}); a failure
 * there is thrown from the constructor. The worker queue must be declared with
 * {@code x-dead-letter-exchange} pointing at the retry exchange
 * ({@link MaxRetryOptions#workerQueueArguments(String)}) so that a plain reject lands in the
 * retry queue, waits out the TTL, and returns through the requeue exchange.
 * 
 * Decision per failed delivery, with {@code n} = prior failures on this worker queue:
 * - requeue requested: reject with requeue, history ignored
 * - {@code n + 1 <= maxRetries}: reject without requeue (retry after the TTL)
 * - otherwise: publish unchanged to the error exchange, then acknowledge
 * 
 * Not thread-safe: it shares one channel for every call, so callers must serialize access
 * or use one handler (and channel) per thread.
 */
public class MaxRetryHandler implements DeliveryHandler {

    private static final Logger log = LoggerFactory.getLogger(MaxRetryHandler.class);

    public static final String ACK_METRIC = "ack";
    public static final String RETRY_METRIC = "retry";
    public static final String REQUEUE_METRIC = "requeue";
    public static final String DEAD_LETTER_METRIC = "dead_letter";
    public static final String NOOP_METRIC = "noop";

    private final Channel channel;
    private final MaxRetryOptions options;
    private final RetryMetrics metrics;
    private final TopologyNames names;
    private final ErrorSink errorSink;

    public MaxRetryHandler(Channel channel, String workerQueue, MaxRetryOptions options) {
        this(channel, workerQueue, options, RetryMetrics.noop());
    }

    public MaxRetryHandler(Channel channel, String workerQueue, MaxRetryOptions options, RetryMetrics metrics) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.options = Objects.requireNonNull(options, "options");
        this.metrics = Objects.requireNonNull(metrics, "metrics");

        log.debug("Creating a max-retry handler for queue({}), opts({})", workerQueue, options);
        this.names = RetryTopology.declare(channel, workerQueue, options);
        this.errorSink = new ChannelErrorSink(channel, names.errorExchange());
    }

    @Override
    public Disposition acknowledge(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        try (DeliveryContext ignored = openContext(envelope, properties)) {
            ack(envelope.getDeliveryTag());
            record(ACK_METRIC);
            return Disposition.ACKNOWLEDGE;
        }
    }

    @Override
    public Disposition reject(Envelope envelope, AMQP.BasicProperties properties, byte[] body, boolean requeue) {
        try (DeliveryContext ignored = openContext(envelope, properties)) {
            long deliveryTag = envelope.getDeliveryTag();

            if (requeue) {
                log.debug("Requeueing delivery {} without counting it as a failure", deliveryTag);
                basicReject(deliveryTag, true);
                record(REQUEUE_METRIC);
                return Disposition.RETRY_REJECT;
            }

            long attempt = failureCount(properties) + 1;
            if (attempt <= options.getMaxRetries()) {
                // dead-letters into the retry exchange, comes back after the retry queue TTL
                log.debug("Retrying failure, count {}, headers {}", attempt, headersOf(properties));
                basicReject(deliveryTag, false);
                record(RETRY_METRIC);
                return Disposition.RETRY_REJECT;
            }

            log.warn("Max retries ({}) exceeded for delivery {} on {}, publishing to {}",
                    options.getMaxRetries(), deliveryTag, names.workerQueue(), names.errorExchange());
            publishToError(envelope, properties, body);
            ack(deliveryTag);
            record(DEAD_LETTER_METRIC);
            return Disposition.DEAD_LETTER;
        }
    }

    @Override
    public Disposition error(Envelope envelope, AMQP.BasicProperties properties, byte[] body, Throwable error) {
        log.debug("Delivery {} on {} failed: {}", envelope.getDeliveryTag(), names.workerQueue(),
                error == null ? "unknown error" : error.toString());
        return reject(envelope, properties, body, false);
    }

    @Override
    public Disposition timeout(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        log.debug("Delivery {} on {} timed out", envelope.getDeliveryTag(), names.workerQueue());
        return reject(envelope, properties, body, false);
    }

    @Override
    public void noop(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        record(NOOP_METRIC);
    }

    /**
     * Prior failures of this delivery on the worker queue; the current one is not included.
     */
    public long failureCount(AMQP.BasicProperties properties) {
        return FailureCounter.count(headersOf(properties), names.workerQueue(), options.getDeathCountStrategy());
    }

    public TopologyNames getTopologyNames() {
        return names;
    }

    public MaxRetryOptions getOptions() {
        return options;
    }

    private void ack(long deliveryTag) {
        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException e) {
            throw BrokerOperationException.acknowledge(names.workerQueue(), deliveryTag, e);
        }
    }

    private void basicReject(long deliveryTag, boolean requeue) {
        try {
            channel.basicReject(deliveryTag, requeue);
        } catch (IOException e) {
            throw BrokerOperationException.reject(names.workerQueue(), deliveryTag, e);
        }
    }

    private void publishToError(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        try {
            errorSink.publish(envelope.getRoutingKey(), properties, body);
        } catch (IOException e) {
            throw BrokerOperationException.publish(names.workerQueue(), envelope.getDeliveryTag(), e);
        }
    }

    private void record(String outcome) {
        metrics.increment(names.workerQueue() + "." + outcome);
    }

    private DeliveryContext openContext(Envelope envelope, AMQP.BasicProperties properties) {
        DeliveryContext context = DeliveryContext.open(
                names.workerQueue(), envelope.getRoutingKey(), envelope.getDeliveryTag());
        if (properties != null) {
            context.withMessageId(properties.getMessageId())
                    .withCorrelationId(properties.getCorrelationId());
        }
        return context;
    }

    private static Map<String, Object> headersOf(AMQP.BasicProperties properties) {
        return properties == null ? null : properties.getHeaders();
    }
}
