package com.aiide.backbone.core.service;

import com.aiide.backbone.core.init.LazyOnce;
import org.jboss.logging.Logger;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry entry: the descriptor, its lazy-once cell and shutdown state.
 * <p>
 * Cleanup runs at most once per slot. An instance whose construction finishes
 * after teardown has begun is cleaned up by the constructing thread.
 */
final class ServiceSlot<T> {

    private static final Logger log = Logger.getLogger(ServiceSlot.class);

    private final ServiceDescriptor<T> descriptor;
    private final int order;
    private final LazyOnce<T> lazy;
    private final AtomicInteger references = new AtomicInteger();
    private final AtomicBoolean cleaned = new AtomicBoolean();
    private volatile ServiceState teardown;

    ServiceSlot(ServiceDescriptor<T> descriptor, int order,
                LazyOnce.Initializer<T> initializer, LazyOnce.TransitionListener listener) {
        this.descriptor = descriptor;
        this.order = order;
        this.lazy = new LazyOnce<>(descriptor.name(), () -> constructed(initializer.initialize()), listener);
    }

    String name() {
        return descriptor.name();
    }

    ServiceDescriptor<T> descriptor() {
        return descriptor;
    }

    int order() {
        return order;
    }

    LazyOnce<T> lazy() {
        return lazy;
    }

    AtomicInteger references() {
        return references;
    }

    ServiceState state() {
        ServiceState t = teardown;
        return t != null ? t : ServiceState.of(lazy.state());
    }

    boolean inTeardown() {
        return teardown != null;
    }

    void markTeardown(ServiceState state) {
        teardown = state;
    }

    /**
     * Runs the registered cleanup for {@code instance} unless it already ran.
     * Cleanup failures are logged.
     */
    void cleanup(T instance) {
        if (instance == null || !cleaned.compareAndSet(false, true)) {
            return;
        }
        try {
            descriptor.cleanup().cleanup(instance);
        } catch (Exception e) {
            log.errorf(e, "Cleanup of service '%s' failed", descriptor.name());
        }
    }

    private T constructed(T instance) {
        if (inTeardown()) {
            log.warnf("Service '%s' finished initializing after shutdown began; cleaning it up", descriptor.name());
            cleanup(instance);
        }
        return instance;
    }
}
