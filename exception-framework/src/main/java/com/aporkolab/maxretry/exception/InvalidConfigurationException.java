package com.aporkolab.maxretry.exception;

/**
 * Handler options that cannot produce a valid retry topology.
 * Raised before any broker call is made.
 */
public class InvalidConfigurationException extends MaxRetryException {

    public InvalidConfigurationException(String option, String message) {
        super("INVALID_CONFIGURATION", String.format("Invalid option '%s': %s", option, message));
        with("option", option);
    }

    public static InvalidConfigurationException nameClash(String option, String name) {
        InvalidConfigurationException exception = new InvalidConfigurationException(
                option, String.format("name '%s' is already used by another entity of the retry topology", name));
        exception.with("name", name);
        return exception;
    }
}
