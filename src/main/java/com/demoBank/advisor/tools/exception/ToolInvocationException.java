package com.demoBank.advisor.tools.exception;

import lombok.Getter;

/**
 * Exception thrown when a tool call fails.
 * Transient failures (connection errors, 5xx) may be retried; everything else may not.
 */
@Getter
public class ToolInvocationException extends RuntimeException {

    private final String errorKind;
    private final boolean transientFailure;

    public ToolInvocationException(String errorKind, String message, boolean transientFailure) {
        super(message);
        this.errorKind = errorKind;
        this.transientFailure = transientFailure;
    }

    public ToolInvocationException(String errorKind, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
        this.transientFailure = transientFailure;
    }
}
