package com.helix.guardrails.exception;

/**
 * Root of the unchecked exceptions raised by the guardrails core.
 *
 * Malformed model output is deliberately not part of this hierarchy: it is
 * reported as an error-tagged result map instead.
 */
public class HelixException extends RuntimeException {

    public HelixException(String message) {
        super(message);
    }

    public HelixException(String message, Throwable cause) {
        super(message, cause);
    }
}
