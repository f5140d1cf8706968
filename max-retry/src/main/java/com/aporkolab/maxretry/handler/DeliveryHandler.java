package com.aporkolab.maxretry.handler;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

/**
 * Disposes of a delivery once its worker is done with it.
 * Exactly one method is called per delivery.
 */
public interface DeliveryHandler {

    /**
     * The work succeeded.
     */
    Disposition acknowledge(Envelope envelope, AMQP.BasicProperties properties, byte[] body);

    /**
     * The worker rejected the message. With {@code requeue} set the message goes straight
     * back to the worker queue regardless of how often it failed before.
     */
    Disposition reject(Envelope envelope, AMQP.BasicProperties properties, byte[] body, boolean requeue);

    default Disposition reject(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        return reject(envelope, properties, body, false);
    }

    /**
     * The worker threw.
     */
    Disposition error(Envelope envelope, AMQP.BasicProperties properties, byte[] body, Throwable error);

    /**
     * The worker did not finish in time.
     */
    Disposition timeout(Envelope envelope, AMQP.BasicProperties properties, byte[] body);

    /**
     * Something upstream already settled the delivery; touch nothing.
     */
    void noop(Envelope envelope, AMQP.BasicProperties properties, byte[] body);
}
