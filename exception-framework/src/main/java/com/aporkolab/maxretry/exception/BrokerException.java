package com.aporkolab.maxretry.exception;

/**
 * Base class for failures reported by the broker channel.
 * 
 * These are never retried by the handler itself: retry is a message-level
 * concept, not a network-call-level one.
 */
public abstract class BrokerException extends MaxRetryException {

    protected BrokerException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
