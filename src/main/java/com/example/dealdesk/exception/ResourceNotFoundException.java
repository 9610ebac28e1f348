package com.example.dealdesk.exception;

/**
 * Exception thrown when a requested program does not exist
 */
public class ResourceNotFoundException extends DealDeskException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
