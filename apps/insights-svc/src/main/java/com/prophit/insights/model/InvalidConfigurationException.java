package com.prophit.insights.model;

/**
 * Raised when a persona or generation window cannot be used as given.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
