package com.immowatch.backend.dedup.exception;

/**
 * Caller misconfiguration of a detection run. Raised before any listing is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
