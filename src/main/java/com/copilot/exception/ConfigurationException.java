package com.copilot.exception;

/**
 * Exception thrown when configuration is invalid.
 * Results in fail-fast before a decision run starts.
 */
public class ConfigurationException extends CopilotException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
