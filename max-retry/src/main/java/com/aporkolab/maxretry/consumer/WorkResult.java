package com.aporkolab.maxretry.consumer;

/**
 * What a worker wants done with the message it just processed.
 */
public enum WorkResult {
    ACK,
    REJECT,
    REQUEUE,
    NOOP
}
