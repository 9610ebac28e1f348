package com.example.dealdesk.exception;

/**
 * Base exception for the deal desk service
 */
public class DealDeskException extends RuntimeException {

    public DealDeskException(String message) {
        super(message);
    }

    public DealDeskException(String message, Throwable cause) {
        super(message, cause);
    }
}
