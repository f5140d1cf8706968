package com.aporkolab.maxretry.exception;

/**
 * A declare or bind of the retry topology failed.
 * The handler under construction is unusable.
 */
public class TopologyDeclarationException extends BrokerException {

    public TopologyDeclarationException(String entity, String name, String workerQueue, Throwable cause) {
        super(
            "TOPOLOGY_DECLARATION_FAILED",
            String.format("Failed to declare %s '%s' for worker queue '%s': %s",
                    entity, name, workerQueue, cause.getMessage()),
            cause
        );
        with("entity", entity);
        with("name", name);
        with("workerQueue", workerQueue);
    }

    public static TopologyDeclarationException exchange(String name, String workerQueue, Throwable cause) {
        return new TopologyDeclarationException("exchange", name, workerQueue, cause);
    }

    public static TopologyDeclarationException queue(String name, String workerQueue, Throwable cause) {
        return new TopologyDeclarationException("queue", name, workerQueue, cause);
    }

    public static TopologyDeclarationException binding(String queue, String exchange, String workerQueue,
                                                       Throwable cause) {
        return new TopologyDeclarationException("binding", queue + " <- " + exchange, workerQueue, cause);
    }
}
