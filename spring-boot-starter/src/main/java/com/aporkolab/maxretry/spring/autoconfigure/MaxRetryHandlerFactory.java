package com.aporkolab.maxretry.spring.autoconfigure;

import com.aporkolab.maxretry.handler.MaxRetryHandler;
import com.aporkolab.maxretry.handler.MaxRetryOptions;
import com.aporkolab.maxretry.metrics.RetryMetrics;
import com.rabbitmq.client.Channel;

/**
 * Creates {@link MaxRetryHandler}s sharing the application's options and metrics.
 * Each call declares the retry topology for the given worker queue on the given channel.
 */
public class MaxRetryHandlerFactory {

    private final MaxRetryOptions options;
    private final RetryMetrics metrics;

    public MaxRetryHandlerFactory(MaxRetryOptions options, RetryMetrics metrics) {
        this.options = options;
        this.metrics = metrics;
    }

    public MaxRetryHandler create(Channel channel, String workerQueue) {
        return new MaxRetryHandler(channel, workerQueue, options, metrics);
    }

    public MaxRetryOptions getOptions() {
        return options;
    }

    public RetryMetrics getMetrics() {
        return metrics;
    }
}
