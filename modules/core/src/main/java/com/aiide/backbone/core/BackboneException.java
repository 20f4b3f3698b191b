package com.aiide.backbone.core;

/**
 * Root of the unchecked exceptions raised by the service lifecycle and
 * shared-resource layer. Checked exceptions thrown by user code (factories,
 * task bodies, pooled-resource callbacks) are wrapped in one of these.
 */
public class BackboneException extends RuntimeException {

    public BackboneException(String message) {
        super(message);
    }

    public BackboneException(String message, Throwable cause) {
        super(message, cause);
    }
}
