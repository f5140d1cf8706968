package com.aporkolab.maxretry.logging;

import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

/**
 * Scopes the identity of one broker delivery onto the MDC (Mapped Diagnostic Context),
 * so every log line written while a delivery is being worked on or disposed of
 * carries the worker queue, routing key and delivery tag.
 * 
 * Usage:
 * <pre>
 * try (var ctx = DeliveryContext.open("orders", "order.created", 17L)
 *         .withMessageId(properties.getMessageId())
 *         .withCorrelationId(properties.getCorrelationId())) {
 *     log.debug("Retrying failure"); // Logs include workerQueue, routingKey, deliveryTag
 * }
 * </pre>
 * 
 * Closing restores whatever MDC content existed before the context was opened.
 */
public class DeliveryContext implements AutoCloseable {

    public static final String WORKER_QUEUE_KEY = "workerQueue";
    public static final String ROUTING_KEY_KEY = "routingKey";
    public static final String DELIVERY_TAG_KEY = "deliveryTag";
    public static final String MESSAGE_ID_KEY = "messageId";
    public static final String CORRELATION_ID_KEY = "correlationId";

    private final Map<String, String> previousContext;

    private DeliveryContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Opens a context for one delivery.
     */
    public static DeliveryContext open(String workerQueue, String routingKey, long deliveryTag) {
        Map<String, String> previous = MDC.getCopyOfContextMap();

        DeliveryContext context = new DeliveryContext(previous);
        context.with(WORKER_QUEUE_KEY, workerQueue);
        context.with(ROUTING_KEY_KEY, routingKey);
        context.with(DELIVERY_TAG_KEY, String.valueOf(deliveryTag));
        return context;
    }

    /**
     * Gets the worker queue of the delivery in scope, or null if none.
     */
    public static String getCurrentWorkerQueue() {
        return MDC.get(WORKER_QUEUE_KEY);
    }

    /**
     * Sets an additional value; null values are skipped.
     */
    public DeliveryContext with(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
        return this;
    }

    public DeliveryContext withMessageId(String messageId) {
        return with(MESSAGE_ID_KEY, messageId);
    }

    public DeliveryContext withCorrelationId(String correlationId) {
        return with(CORRELATION_ID_KEY, correlationId);
    }

    /**
     * Wraps a Callable so it runs with the caller's MDC content on another thread.
     */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                return callable.call();
            } finally {
                restore(previous);
            }
        };
    }

    @Override
    public void close() {
        restore(previousContext);
    }

    private static void restore(Map<String, String> previous) {
        if (previous != null) {
            MDC.setContextMap(previous);
        } else {
            MDC.clear();
        }
    }
}
