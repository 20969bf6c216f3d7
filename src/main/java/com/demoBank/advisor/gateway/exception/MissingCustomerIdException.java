package com.demoBank.advisor.gateway.exception;

/**
 * Exception thrown when the X-User-ID header is missing.
 */
public class MissingCustomerIdException extends RuntimeException {

    public MissingCustomerIdException(String message) {
        super(message);
    }
}
