package com.tyron.apphost.core.config;

/**
 * Thrown when a settings document exists but cannot be read.
 */
public class SettingsException extends RuntimeException {

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
