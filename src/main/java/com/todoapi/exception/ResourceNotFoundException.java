package com.todoapi.exception;

/**
 * Exception thrown when a requested resource is not found, or is not owned by the caller.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resource, Object identifier) {
        super(String.format("%s with id %s not found", resource, identifier));
    }
}
