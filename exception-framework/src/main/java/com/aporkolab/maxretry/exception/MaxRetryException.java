package com.aporkolab.maxretry.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for all exceptions raised by the max-retry handler.
 * 
 * Provides:
 * - Error code for programmatic handling
 * - Structured context for debugging
 * - Timestamp for correlation with broker logs
 */
public abstract class MaxRetryException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected MaxRetryException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    protected MaxRetryException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining.
     */
    public MaxRetryException with(String key, Object value) {
        if (value != null) {
            this.context.put(key, value);
        }
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
