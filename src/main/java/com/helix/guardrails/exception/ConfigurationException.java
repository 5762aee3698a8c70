package com.helix.guardrails.exception;

/**
 * Missing or invalid model / workspace configuration. Fatal, never retried.
 */
public class ConfigurationException extends HelixException {

    public ConfigurationException(String message) {
        super(message);
    }
}
