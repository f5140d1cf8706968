package com.aporkolab.maxretry.handler;

import java.util.List;
import java.util.Map;

/**
 * Counts how many times a message has previously been dead-lettered from a worker queue.
 * 
 * The count covers past failures only: the first time a message fails, it is 0.
 * Entries for other queues (the retry queue it expired from, or queues of other
 * workers sharing the same exchanges) never count.
 */
public final class FailureCounter {

    private FailureCounter() {
    }

    /**
     * Number of history entries that died on {@code workerQueue}.
     */
    public static long count(List<DeathRecord> history, String workerQueue) {
        return count(history, workerQueue, DeathCountStrategy.RECORDS);
    }

    public static long count(List<DeathRecord> history, String workerQueue, DeathCountStrategy strategy) {
        if (history == null || history.isEmpty() || workerQueue == null) {
            return 0;
        }

        long failures = 0;
        for (DeathRecord record : history) {
            if (record == null || !record.diedOn(workerQueue)) {
                continue;
            }
            if (strategy == DeathCountStrategy.COUNT_FIELD) {
                // a present entry means at least one death even if the broker left count out
                failures += Math.max(record.count(), 1);
            } else {
                failures++;
            }
        }
        return failures;
    }

    /**
     * Count straight from message headers; absent headers or history count as 0.
     */
    public static long count(Map<String, Object> headers, String workerQueue) {
        return count(DeathRecord.fromHeaders(headers), workerQueue);
    }

    public static long count(Map<String, Object> headers, String workerQueue, DeathCountStrategy strategy) {
        return count(DeathRecord.fromHeaders(headers), workerQueue, strategy);
    }
}
