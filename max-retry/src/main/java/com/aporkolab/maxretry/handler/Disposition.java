package com.aporkolab.maxretry.handler;

/**
 * What happened to a delivery.
 */
public enum Disposition {

    /** Acknowledged; the message is done */
    ACKNOWLEDGE,

    /** Rejected; the broker routes it through the retry queue (or straight back, when requeued) */
    RETRY_REJECT,

    /** Out of retries; published to the error exchange and acknowledged */
    DEAD_LETTER
}
