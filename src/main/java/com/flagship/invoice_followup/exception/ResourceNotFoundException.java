package com.flagship.invoice_followup.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a requested aggregate does not exist. Mapped to 404.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final UUID resourceId;

    public ResourceNotFoundException(String resourceType, UUID resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
