package com.aporkolab.maxretry.handler;

/**
 * Resolved names of the retry topology around one worker queue.
 * The retry and error queues share the names of their exchanges.
 */
public record TopologyNames(String workerQueue, String retryExchange, String errorExchange,
                            String requeueExchange) {

    public String retryQueue() {
        return retryExchange;
    }

    public String errorQueue() {
        return errorExchange;
    }
}
