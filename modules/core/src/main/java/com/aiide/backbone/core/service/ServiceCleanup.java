package com.aiide.backbone.core.service;

@FunctionalInterface
public interface ServiceCleanup<T> {

    void cleanup(T service) throws Exception;

    /** Default cleanup: closes the service if it is {@link AutoCloseable}. */
    static <T> ServiceCleanup<T> closing() {
        return service -> {
            if (service instanceof AutoCloseable closeable) {
                closeable.close();
            }
        };
    }
}
