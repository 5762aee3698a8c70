package com.helix.guardrails.exception;

import lombok.Getter;

@Getter
public class ResourceNotFoundException extends HelixException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
