package com.aporkolab.maxretry.handler;

import java.io.IOException;

import com.rabbitmq.client.AMQP;

/**
 * Destination for messages that ran out of retries.
 */
@FunctionalInterface
public interface ErrorSink {

    /**
     * Publish the message as-is: same routing key, same properties, same body.
     */
    void publish(String routingKey, AMQP.BasicProperties properties, byte[] body) throws IOException;
}
