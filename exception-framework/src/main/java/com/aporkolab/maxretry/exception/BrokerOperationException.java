package com.aporkolab.maxretry.exception;

/**
 * Acknowledge, reject or publish failed on the channel.
 */
public class BrokerOperationException extends BrokerException {

    public BrokerOperationException(String operation, String workerQueue, long deliveryTag, Throwable cause) {
        super(
            "BROKER_OPERATION_FAILED",
            String.format("Broker operation '%s' failed for delivery %d on worker queue '%s': %s",
                    operation, deliveryTag, workerQueue, cause.getMessage()),
            cause
        );
        with("operation", operation);
        with("workerQueue", workerQueue);
        with("deliveryTag", deliveryTag);
    }

    public static BrokerOperationException acknowledge(String workerQueue, long deliveryTag, Throwable cause) {
        return new BrokerOperationException("basic.ack", workerQueue, deliveryTag, cause);
    }

    public static BrokerOperationException reject(String workerQueue, long deliveryTag, Throwable cause) {
        return new BrokerOperationException("basic.reject", workerQueue, deliveryTag, cause);
    }

    public static BrokerOperationException publish(String workerQueue, long deliveryTag, Throwable cause) {
        return new BrokerOperationException("basic.publish", workerQueue, deliveryTag, cause);
    }
}
