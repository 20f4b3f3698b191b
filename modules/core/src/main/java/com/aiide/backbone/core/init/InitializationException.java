package com.aiide.backbone.core.init;

import com.aiide.backbone.core.BackboneException;

/**
 * A constructor failed. The same instance is handed to every caller waiting
 * on, or later asking for, the failed value until it is explicitly reset.
 */
public class InitializationException extends BackboneException {

    private final String name;

    public InitializationException(String name, Throwable cause) {
        super("Initialization of '" + name + "' failed: " + describe(cause), cause);
        this.name = name;
    }

    public InitializationException(String name, String message) {
        super("Initialization of '" + name + "' failed: " + message);
        this.name = name;
    }

    /** Name of the value (service) whose construction failed. */
    public String name() {
        return name;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
