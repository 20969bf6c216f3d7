package com.demoBank.advisor.inference.exception;

/**
 * Exception thrown when the inference endpoint cannot produce a completion.
 */
public class InferenceException extends RuntimeException {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
