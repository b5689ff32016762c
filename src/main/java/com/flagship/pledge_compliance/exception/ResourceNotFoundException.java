package com.flagship.pledge_compliance.exception;

/**
 * Thrown when a requested donor or celebration does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
