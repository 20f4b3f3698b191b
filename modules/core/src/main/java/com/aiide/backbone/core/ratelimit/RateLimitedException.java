package com.aiide.backbone.core.ratelimit;

import com.aiide.backbone.core.BackboneException;

import java.time.Duration;

/**
 * Admission denied for a key. Carries how long until a token is available so
 * the caller can apply its own backoff.
 */
public class RateLimitedException extends BackboneException {

    private final String key;
    private final Duration retryAfter;

    public RateLimitedException(String key, Duration retryAfter) {
        super("Rate limit exceeded for '" + key + "', retry after " + retryAfter.toMillis() + "ms");
        this.key = key;
        this.retryAfter = retryAfter;
    }

    public String key() {
        return key;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
