package com.aiide.backbone.core.cache;

import java.util.Collection;

/**
 * Approximate size of an entry in bytes, used for the {@code maxBytes} bound.
 */
@FunctionalInterface
public interface Weigher<K, V> {

    long weigh(K key, V value);

    /** Rough heap estimate for common value shapes. */
    static <K, V> Weigher<K, V> approximate() {
        return (key, value) -> estimate(key) + estimate(value);
    }

    private static long estimate(Object o) {
        if (o == null) {
            return 0;
        }
        if (o instanceof CharSequence s) {
            return 40L + 2L * s.length();
        }
        if (o instanceof byte[] bytes) {
            return 16L + bytes.length;
        }
        if (o instanceof Collection<?> c) {
            return 32L + 16L * c.size();
        }
        return 64L;
    }
}
