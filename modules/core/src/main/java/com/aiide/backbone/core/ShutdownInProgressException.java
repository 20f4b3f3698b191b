package com.aiide.backbone.core;

/**
 * Thrown when new work is submitted after teardown has begun.
 */
public class ShutdownInProgressException extends BackboneException {

    public ShutdownInProgressException(String message) {
        super(message);
    }
}
