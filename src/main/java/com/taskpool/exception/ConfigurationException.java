package com.taskpool.exception;

/**
 * Thrown when pool configuration cannot be read or holds an invalid value.
 * Raised while the pool is being built, before any worker starts.
 */
public class ConfigurationException extends PoolException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
