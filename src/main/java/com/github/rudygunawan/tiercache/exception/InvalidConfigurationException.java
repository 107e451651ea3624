package com.github.rudygunawan.tiercache.exception;

/**
 * Thrown while configuring or building a cache when a setting is out of range or two settings
 * contradict each other. Fatal at startup.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
