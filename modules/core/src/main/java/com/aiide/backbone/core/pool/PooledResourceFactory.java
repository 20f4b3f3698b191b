package com.aiide.backbone.core.pool;

/**
 * Creates, checks and destroys the expensive handles kept by a {@link ResourcePool}
 * (database connections, HTTP clients, language-server sessions).
 */
public interface PooledResourceFactory<T> {

    T create() throws Exception;

    /**
     * Lazy health check, run on an idle entry right before it is handed out.
     * An entry that fails is destroyed and its slot freed.
     */
    default boolean validate(T resource) throws Exception {
        return true;
    }

    default void destroy(T resource) throws Exception {
        if (resource instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }
}
