package com.demoBank.advisor.gateway.exception;

/**
 * Exception thrown when a customer exceeds the per-minute request budget.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
