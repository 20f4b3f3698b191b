package com.aiide.backbone.core.task;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Failure captured from a task body. The stack trace is truncated so the
 * bounded task history stays small.
 *
 * @param rootCause innermost cause as {@code type: message}, or null when the
 *                  failure has no cause
 */
public record TaskError(
        String message,
        String exceptionType,
        String rootCause,
        String stackTrace
) {
    static final int MAX_TRACE_CHARS = 8 * 1024;

    public static TaskError from(Throwable t) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        String trace = sw.toString();
        if (trace.length() > MAX_TRACE_CHARS) {
            trace = trace.substring(0, MAX_TRACE_CHARS) + "\n\t...";
        }

        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }

        return new TaskError(
                t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName(),
                t.getClass().getName(),
                root == t ? null : root.getClass().getName() + ": " + root.getMessage(),
                trace
        );
    }
}
