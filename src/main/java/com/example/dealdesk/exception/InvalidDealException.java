package com.example.dealdesk.exception;

/**
 * Thrown when a caller passes structurally malformed deal input: a term that is not
 * offered, an unknown mileage tier or payment frequency. Unparsable amounts never
 * raise this; they read as zero.
 */
public class InvalidDealException extends DealDeskException {

    public InvalidDealException(String message) {
        super(message);
    }
}
