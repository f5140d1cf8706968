package com.aporkolab.maxretry.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

/**
 * Application logic run for each delivery on a worker queue.
 * Throwing counts as a failure and goes through the retry path.
 */
@FunctionalInterface
public interface MessageWorker {

    WorkResult work(Envelope envelope, AMQP.BasicProperties properties, byte[] body) throws Exception;
}
