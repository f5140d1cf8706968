package com.aporkolab.maxretry.handler;

import java.io.IOException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

/**
 * Publishes exhausted messages to the error exchange on the handler's channel.
 * Delivery guarantees are those of a plain {@code basic.publish}; enable publisher
 * confirms on the channel for anything stronger.
 */
public class ChannelErrorSink implements ErrorSink {

    private final Channel channel;
    private final String errorExchange;

    public ChannelErrorSink(Channel channel, String errorExchange) {
        this.channel = channel;
        this.errorExchange = errorExchange;
    }

    @Override
    public void publish(String routingKey, AMQP.BasicProperties properties, byte[] body) throws IOException {
        channel.basicPublish(errorExchange, routingKey, properties, body);
    }

    public String getErrorExchange() {
        return errorExchange;
    }
}
