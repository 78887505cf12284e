package com.staydesk.common.exception;

/**
 * Exception thrown when a tenant-scoped resource does not exist (or is inactive where that matters).
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(message, "RESOURCE_NOT_FOUND");
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s %s not found", resourceType, identifier), "RESOURCE_NOT_FOUND");
    }
}
