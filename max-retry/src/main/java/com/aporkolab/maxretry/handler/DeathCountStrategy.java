package com.aporkolab.maxretry.handler;

/**
 * How prior failures are read out of the {@code x-death} history.
 */
public enum DeathCountStrategy {

    /** One failure per history entry naming the worker queue */
    RECORDS,

    /**
     * Sum of the broker's {@code count} field over the entries naming the worker queue.
     * Use with brokers that keep a single entry per queue and reason and increment its count.
     */
    COUNT_FIELD
}
