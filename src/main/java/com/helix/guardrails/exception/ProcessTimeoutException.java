package com.helix.guardrails.exception;

import com.helix.guardrails.model.ServiceType;
import lombok.Getter;

import java.time.Duration;

/**
 * A time-boxed external process exceeded its budget and was killed.
 * No partial output is carried.
 */
@Getter
public class ProcessTimeoutException extends TransientIoException {

    private final Duration timeout;

    public ProcessTimeoutException(ServiceType service, String command, Duration timeout) {
        super(service, "Command timed out after " + timeout.toSeconds() + "s: " + command);
        this.timeout = timeout;
    }
}
