package com.aiide.backbone.core;

import java.time.Duration;

/**
 * Thrown when a blocking operation (pool acquire, waiting for a service to
 * initialize, waiting for a startup phase) did not finish within its timeout.
 */
public class OperationTimeoutException extends BackboneException {

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        this(operation, timeout, "Timed out after " + timeout + ": " + operation);
    }

    protected OperationTimeoutException(String operation, Duration timeout, String message) {
        super(message);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String operation() {
        return operation;
    }

    public Duration timeout() {
        return timeout;
    }
}
