package com.aiide.backbone.core.service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable recipe for a service: identity, construction, dependencies and
 * the startup phase it belongs to.
 */
public final class ServiceDescriptor<T> {

    private final String name;
    private final Class<T> type;
    private final int phase;
    private final Set<String> dependencies;
    private final boolean optional;
    private final ServiceFactory<T> factory;
    private final ServiceCleanup<T> cleanup;

    private ServiceDescriptor(Builder<T> b) {
        this.name = b.name;
        this.type = b.type;
        this.phase = b.phase;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(b.dependencies));
        this.optional = b.optional;
        this.factory = b.factory;
        this.cleanup = b.cleanup;
    }

    public static <T> Builder<T> builder(String name, Class<T> type) {
        return new Builder<>(name, type);
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public int phase() {
        return phase;
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    /** An optional service may fail at startup without stopping later phases. */
    public boolean optional() {
        return optional;
    }

    public ServiceFactory<T> factory() {
        return factory;
    }

    public ServiceCleanup<T> cleanup() {
        return cleanup;
    }

    @Override
    public String toString() {
        return "ServiceDescriptor[" + name + ", phase=" + phase + ", deps=" + dependencies
                + (optional ? ", optional" : "") + "]";
    }

    public static final class Builder<T> {

        private final String name;
        private final Class<T> type;
        private int phase = Phases.CORE_STORAGE;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private boolean optional;
        private ServiceFactory<T> factory;
        private ServiceCleanup<T> cleanup = ServiceCleanup.closing();

        private Builder(String name, Class<T> type) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Service name must not be blank");
            }
            this.name = name;
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder<T> phase(int phase) {
            this.phase = phase;
            return this;
        }

        public Builder<T> dependsOn(String... names) {
            for (String dep : names) {
                if (dep.equals(name)) {
                    throw new IllegalArgumentException("Service '" + name + "' cannot depend on itself");
                }
                dependencies.add(dep);
            }
            return this;
        }

        public Builder<T> optional() {
            return optional(true);
        }

        public Builder<T> optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder<T> factory(ServiceFactory<T> factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public Builder<T> cleanup(ServiceCleanup<T> cleanup) {
            this.cleanup = Objects.requireNonNull(cleanup, "cleanup");
            return this;
        }

        public ServiceDescriptor<T> build() {
            if (factory == null) {
                throw new IllegalStateException("Service '" + name + "' has no factory");
            }
            return new ServiceDescriptor<>(this);
        }
    }
}
