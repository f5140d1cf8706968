package com.aporkolab.maxretry.handler;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.maxretry.exception.TopologyDeclarationException;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;

/**
 * Declares the exchanges, queues and bindings that implement broker-side retry around a worker queue.
 * 
 * Input: an already declared worker queue. Created:
 * <pre>
 * &lt;queue&gt;-retry          (X) topic exchange the worker queue dead-letters into
 * &lt;queue&gt;-retry          (Q) bound with '#', TTL = retry timeout, dead-letters to &lt;queue&gt;-retry-requeue
 * &lt;queue&gt;-error          (X) topic exchange for messages out of retries
 * &lt;queue&gt;-error          (Q) bound with '#'
 * &lt;queue&gt;-retry-requeue  (X) topic exchange the worker queue is bound to with '#'
 * </pre>
 * 
 * Every call is declare-if-absent, so running it again with the same options is harmless.
 * The first failing declare or bind aborts the whole declaration.
 */
public final class RetryTopology {

    private static final Logger log = LoggerFactory.getLogger(RetryTopology.class);

    public static final String MATCH_ALL = "#";

    private RetryTopology() {
    }

    /**
     * @return the resolved names of the declared topology
     * @throws TopologyDeclarationException if any declare or bind fails
     */
    public static TopologyNames declare(Channel channel, String workerQueue, MaxRetryOptions options) {
        TopologyNames names = options.resolveNames(workerQueue);
        boolean durable = options.isDurable();

        for (String exchange : List.of(names.retryExchange(), names.errorExchange(), names.requeueExchange())) {
            log.debug("Creating exchange {} for retry handler on worker queue {}", exchange, workerQueue);
            try {
                channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, durable);
            } catch (IOException e) {
                throw TopologyDeclarationException.exchange(exchange, workerQueue, e);
            }
        }

        log.debug("Creating queue {}, dead lettering to {}", names.retryQueue(), names.requeueExchange());
        declareQueue(channel, names.retryQueue(), durable, options.retryQueueArguments(names), workerQueue);
        bind(channel, names.retryQueue(), names.retryExchange(), workerQueue);

        log.debug("Creating queue {}", names.errorQueue());
        declareQueue(channel, names.errorQueue(), durable, null, workerQueue);
        bind(channel, names.errorQueue(), names.errorExchange(), workerQueue);

        // closes the loop: expired retries come back to the worker queue whatever their routing key
        bind(channel, workerQueue, names.requeueExchange(), workerQueue);

        log.info("Retry topology ready for worker queue {}: retry={}, error={}, requeue={}, ttl={}ms",
                workerQueue, names.retryExchange(), names.errorExchange(), names.requeueExchange(),
                options.getRetryTimeout().toMillis());
        return names;
    }

    private static void declareQueue(Channel channel, String queue, boolean durable,
                                     Map<String, Object> arguments, String workerQueue) {
        try {
            channel.queueDeclare(queue, durable, false, false, arguments);
        } catch (IOException e) {
            throw TopologyDeclarationException.queue(queue, workerQueue, e);
        }
    }

    private static void bind(Channel channel, String queue, String exchange, String workerQueue) {
        try {
            channel.queueBind(queue, exchange, MATCH_ALL);
        } catch (IOException e) {
            throw TopologyDeclarationException.binding(queue, exchange, workerQueue, e);
        }
    }
}
