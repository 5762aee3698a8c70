package com.helix.guardrails.exception;

import com.helix.guardrails.model.ServiceType;
import lombok.Getter;

/**
 * A store, model endpoint or external process could not be reached or failed mid-call.
 * Not retried inside the core; the caller decides the request-level policy.
 */
@Getter
public class TransientIoException extends HelixException {

    private final ServiceType service;

    public TransientIoException(ServiceType service, String message) {
        super(message);
        this.service = service;
    }

    public TransientIoException(ServiceType service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }
}
