package com.aporkolab.maxretry.consumer;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.maxretry.handler.DeliveryHandler;
import com.aporkolab.maxretry.logging.DeliveryContext;
import com.aporkolab.maxretry.metrics.RetryMetrics;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;

/**
 * Consumer that runs a {@link MessageWorker} per delivery and hands the outcome to a {@link DeliveryHandler}.
 * 
 * Outcome mapping:
 * - ACK -> acknowledge, REJECT -> reject, REQUEUE -> reject with requeue, NOOP -> noop
 * - worker exception (or no result) -> error
 * - worker still running after the timeout -> timeout, and the worker is cancelled
 * - work pool refusing the task (e.g. shut down) -> error
 * 
 * The worker runs on the supplied pool only so that it can be timed out; the consumer thread
 * waits for it and performs the disposition itself, keeping all channel calls on one thread.
 * Manual acknowledgements are required ({@code autoAck = false}).
 */
public class MaxRetryConsumer extends DefaultConsumer {

    private static final Logger log = LoggerFactory.getLogger(MaxRetryConsumer.class);

    public static final String STARTED_METRIC = "started";
    public static final String TIME_METRIC = "time";

    private final String workerQueue;
    private final DeliveryHandler handler;
    private final MessageWorker worker;
    private final ExecutorService workPool;
    private final Duration timeout;
    private final RetryMetrics metrics;

    public MaxRetryConsumer(Channel channel, String workerQueue, DeliveryHandler handler, MessageWorker worker,
                            ExecutorService workPool, Duration timeout, RetryMetrics metrics) {
        super(channel);
        this.workerQueue = Objects.requireNonNull(workerQueue, "workerQueue");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.worker = Objects.requireNonNull(worker, "worker");
        this.workPool = Objects.requireNonNull(workPool, "workPool");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
    }

    /**
     * Start consuming the worker queue with manual acknowledgements.
     *
     * @return the consumer tag assigned by the broker
     */
    public String start() throws IOException {
        String consumerTag = getChannel().basicConsume(workerQueue, false, this);
        log.info("Consuming {} with tag {}, timeout {}ms", workerQueue, consumerTag, timeout.toMillis());
        return consumerTag;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        try (DeliveryContext ignored = DeliveryContext.open(workerQueue, envelope.getRoutingKey(), envelope.getDeliveryTag())
                .withMessageId(properties == null ? null : properties.getMessageId())
                .withCorrelationId(properties == null ? null : properties.getCorrelationId())) {
            metrics.increment(workerQueue + "." + STARTED_METRIC);
            metrics.timing(workerQueue + "." + TIME_METRIC, () -> process(envelope, properties, body));
        }
    }

    void process(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        Future<WorkResult> future;
        try {
            future = workPool.submit(DeliveryContext.wrap(() -> worker.work(envelope, properties, body)));
        } catch (RejectedExecutionException e) {
            log.warn("Work pool for {} refused the delivery: {}", workerQueue, e.toString());
            handler.error(envelope, properties, body, e);
            return;
        }

        WorkResult result;
        try {
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Worker on {} timed out after {}ms", workerQueue, timeout.toMillis());
            handler.timeout(envelope, properties, body);
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Worker on {} failed: {}", workerQueue, cause.toString(), cause);
            handler.error(envelope, properties, body, cause);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for worker on {}", workerQueue);
            handler.error(envelope, properties, body, e);
            return;
        }

        dispatch(result, envelope, properties, body);
    }

    private void dispatch(WorkResult result, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        if (result == null) {
            handler.error(envelope, properties, body, new IllegalStateException("worker returned no result"));
            return;
        }

        switch (result) {
            case ACK -> handler.acknowledge(envelope, properties, body);
            case REJECT -> handler.reject(envelope, properties, body, false);
            case REQUEUE -> handler.reject(envelope, properties, body, true);
            case NOOP -> handler.noop(envelope, properties, body);
        }
    }

    public String getWorkerQueue() {
        return workerQueue;
    }
}
