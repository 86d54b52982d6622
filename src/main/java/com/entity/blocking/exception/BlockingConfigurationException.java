package com.entity.blocking.exception;

/**
 * Runtime exception thrown when blocking is set up with an inconsistent configuration,
 * such as a comparator requested for a field type whose corpus was never configured.
 */
public class BlockingConfigurationException extends RuntimeException {

    public BlockingConfigurationException(String message) {
        super(message);
    }

    public BlockingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
