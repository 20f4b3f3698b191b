package com.aiide.backbone.core.service;

import com.aiide.backbone.core.ShutdownInProgressException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Reference-counted access to a ready service. Every handle for the same
 * service wraps the same instance. A handle stops handing out the instance
 * once the owning {@link LifecycleManager} starts shutting down.
 */
public final class ServiceHandle<T> implements AutoCloseable {

    private final String name;
    private final T service;
    private final AtomicInteger references;
    private final BooleanSupplier ownerAlive;
    private final AtomicBoolean closed = new AtomicBoolean();

    ServiceHandle(String name, T service, AtomicInteger references, BooleanSupplier ownerAlive) {
        this.name = name;
        this.service = service;
        this.references = references;
        this.ownerAlive = ownerAlive;
        references.incrementAndGet();
    }

    public String name() {
        return name;
    }

    /**
     * @throws ShutdownInProgressException once the lifecycle manager is shutting down
     * @throws IllegalStateException       if this handle was closed
     */
    public T get() {
        if (closed.get()) {
            throw new IllegalStateException("Handle for service '" + name + "' is closed");
        }
        if (!ownerAlive.getAsBoolean()) {
            throw new ShutdownInProgressException("Service '" + name + "' is no longer available: shutdown in progress");
        }
        return service;
    }

    public boolean isValid() {
        return !closed.get() && ownerAlive.getAsBoolean();
    }

    /** Releases this reference. Idempotent. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            references.decrementAndGet();
        }
    }

    @Override
    public String toString() {
        return "ServiceHandle[" + name + "]";
    }
}
