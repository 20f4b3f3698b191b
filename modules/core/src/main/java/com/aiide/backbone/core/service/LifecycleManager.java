package com.aiide.backbone.core.service;

import com.aiide.backbone.core.BackboneException;
import com.aiide.backbone.core.OperationTimeoutException;
import com.aiide.backbone.core.ShutdownInProgressException;
import com.aiide.backbone.core.cache.CacheManager;
import com.aiide.backbone.core.event.BackboneEvent;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.event.EventKind;
import com.aiide.backbone.core.init.InitializationException;
import com.aiide.backbone.core.init.LazyOnce;
import com.aiide.backbone.core.pool.PoolRegistry;
import com.aiide.backbone.core.ratelimit.RateLimiter;
import com.aiide.backbone.core.task.TaskBuilder;
import com.aiide.backbone.core.task.TaskSupervisor;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Owns every registered service and the shared resources they use.
 * <p>
 * Services are constructed lazily on first {@link #getService} or eagerly by
 * {@link #startAll()}, phase by phase in ascending order. Dependencies are
 * always resolved before the dependent is constructed. {@link #shutdownAll()}
 * tears services down in reverse phase order, then closes the task
 * supervisor, the pools and the caches.
 */
public class LifecycleManager implements AutoCloseable {

    private static final Logger log = Logger.getLogger(LifecycleManager.class);

    public enum ManagerState { CREATED, STARTING, RUNNING, START_FAILED, SHUTTING_DOWN, STOPPED }

    private final LifecycleSettings settings;
    private final EventBus events;
    private final TaskSupervisor tasks;
    private final PoolRegistry pools;
    private final CacheManager caches;
    private final RateLimiter rateLimiter;

    private final Map<String, ServiceSlot<?>> slots = new ConcurrentHashMap<>();
    private final AtomicInteger registrationOrder = new AtomicInteger();
    private final AtomicReference<ManagerState> state = new AtomicReference<>(ManagerState.CREATED);
    private final Object shutdownLock = new Object();
    private final ExecutorService startupExecutor;

    public LifecycleManager(LifecycleSettings settings, EventBus events, TaskSupervisor tasks,
                            PoolRegistry pools, CacheManager caches, RateLimiter rateLimiter) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.events = Objects.requireNonNull(events, "events");
        this.tasks = Objects.requireNonNull(tasks, "tasks");
        this.pools = Objects.requireNonNull(pools, "pools");
        this.caches = Objects.requireNonNull(caches, "caches");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.startupExecutor = Executors.newCachedThreadPool(new StartupThreadFactory());
    }

    // -- registration --

    /**
     * @throws IllegalArgumentException    if the name is already registered
     * @throws ShutdownInProgressException after shutdown has begun
     */
    public <T> void register(ServiceDescriptor<T> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        ensureAccepting("register service '" + descriptor.name() + "'");
        ServiceSlot<T> slot = new ServiceSlot<>(descriptor, registrationOrder.getAndIncrement(),
                () -> construct(descriptor),
                (from, to, failure) -> onTransition(descriptor.name(), ServiceState.of(from),
                        ServiceState.of(to), failure));
        if (slots.putIfAbsent(descriptor.name(), slot) != null) {
            throw new IllegalArgumentException("Service '" + descriptor.name() + "' is already registered");
        }
        log.debugf("Registered %s", descriptor);
    }

    /** Registers everything the module contributes. */
    public void install(ServiceModule module) {
        module.register(this::register);
    }

    /**
     * Checks that every dependency exists, starts no later than its dependent,
     * and that the graph has no cycles.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public void validateGraph() {
        for (ServiceSlot<?> slot : ordered()) {
            for (String dep : slot.descriptor().dependencies()) {
                ServiceSlot<?> target = slots.get(dep);
                if (target == null) {
                    throw new IllegalStateException("Service '" + slot.name()
                            + "' depends on unknown service '" + dep + "'");
                }
                if (target.descriptor().phase() > slot.descriptor().phase()) {
                    throw new IllegalStateException("Service '" + slot.name() + "' (phase "
                            + slot.descriptor().phase() + ") depends on '" + dep
                            + "' which starts later (phase " + target.descriptor().phase() + ")");
                }
            }
        }
        Set<String> done = new HashSet<>();
        for (ServiceSlot<?> slot : ordered()) {
            detectCycle(slot.name(), new ArrayDeque<>(), done);
        }
    }

    private void detectCycle(String name, Deque<String> path, Set<String> done) {
        if (done.contains(name)) {
            return;
        }
        if (path.contains(name)) {
            throw new IllegalStateException("Dependency cycle: " + cycleText(path, name));
        }
        path.addLast(name);
        for (String dep : slots.get(name).descriptor().dependencies()) {
            detectCycle(dep, path, done);
        }
        path.removeLast();
        done.add(name);
    }

    // -- startup --

    /**
     * Initializes every service, one phase at a time. Services within a phase
     * are initialized concurrently. A failed required service stops startup:
     * later phases are not attempted and the failure is rethrown. A failed
     * optional service is logged and startup continues.
     *
     * @throws InitializationException   for the first required service that failed
     * @throws OperationTimeoutException if a phase did not finish within the phase timeout
     * @throws IllegalStateException     if the dependency graph is invalid
     */
    public void startAll() {
        if (!state.compareAndSet(ManagerState.CREATED, ManagerState.STARTING)
                && !state.compareAndSet(ManagerState.START_FAILED, ManagerState.STARTING)) {
            ManagerState current = state.get();
            if (current == ManagerState.SHUTTING_DOWN || current == ManagerState.STOPPED) {
                throw new ShutdownInProgressException("Cannot start: lifecycle manager is " + current);
            }
            throw new IllegalStateException("Cannot start: lifecycle manager is " + current);
        }
        try {
            validateGraph();
            TreeMap<Integer, List<ServiceSlot<?>>> phases = phases();
            log.infof("Starting %d services in %d phases", slots.size(), phases.size());
            for (Map.Entry<Integer, List<ServiceSlot<?>>> phase : phases.entrySet()) {
                startPhase(phase.getKey(), phase.getValue());
            }
        } catch (RuntimeException e) {
            state.compareAndSet(ManagerState.STARTING, ManagerState.START_FAILED);
            throw e;
        }
        if (state.compareAndSet(ManagerState.STARTING, ManagerState.RUNNING)) {
            log.infof("All phases started: %s", status());
        }
    }

    private void startPhase(int phase, List<ServiceSlot<?>> members) {
        ensureAccepting("start phase " + phase);
        log.infof("Starting phase %d: %s", phase, names(members));
        Map<ServiceSlot<?>, CompletableFuture<Void>> futures = new LinkedHashMap<>();
        for (ServiceSlot<?> slot : members) {
            futures.put(slot, CompletableFuture.runAsync(
                    () -> resolve(slot.name(), settings.phaseTimeout(), new ArrayDeque<>()), startupExecutor));
        }
        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
                    .get(settings.phaseTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            List<String> pending = futures.entrySet().stream()
                    .filter(f -> !f.getValue().isDone())
                    .map(f -> f.getKey().name())
                    .collect(Collectors.toList());
            log.errorf("Phase %d did not finish within %s, still initializing: %s",
                    phase, settings.phaseTimeout(), pending);
            throw new OperationTimeoutException("startup phase " + phase + " " + pending, settings.phaseTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackboneException("Interrupted while starting phase " + phase, e);
        } catch (ExecutionException e) {
            // every member has settled; failures are inspected per service below
            log.debugf("Phase %d finished with failures", phase);
        }

        RuntimeException firstRequired = null;
        for (Map.Entry<ServiceSlot<?>, CompletableFuture<Void>> f : futures.entrySet()) {
            Throwable failure = failureOf(f.getValue());
            if (failure == null) {
                continue;
            }
            ServiceDescriptor<?> descriptor = f.getKey().descriptor();
            if (descriptor.optional()) {
                log.warnf("Optional service '%s' failed to start, continuing: %s",
                        descriptor.name(), failure.getMessage());
            } else if (firstRequired == null) {
                firstRequired = failure instanceof RuntimeException re
                        ? re
                        : new InitializationException(descriptor.name(), failure);
            }
        }
        if (firstRequired != null) {
            log.errorf("Startup aborted in phase %d: %s", phase, firstRequired.getMessage());
            throw firstRequired;
        }
    }

    private static Throwable failureOf(CompletableFuture<Void> future) {
        if (!future.isCompletedExceptionally()) {
            return null;
        }
        try {
            future.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        }
    }

    // -- lookup --

    /** Returns the service, initializing it (and its dependencies) if needed. */
    public ServiceHandle<?> getService(String name) {
        return getService(name, Object.class, settings.initTimeout());
    }

    public <T> ServiceHandle<T> getService(String name, Class<T> type) {
        return getService(name, type, settings.initTimeout());
    }

    /**
     * @throws ServiceNotFoundException    if nothing is registered under {@code name}
     * @throws InitializationException     if the service or one of its dependencies failed
     * @throws OperationTimeoutException   if another caller is constructing it and it did
     *                                     not settle within {@code timeout}
     * @throws ShutdownInProgressException after shutdown has begun
     * @throws ClassCastException          if the service is not a {@code type}
     */
    public <T> ServiceHandle<T> getService(String name, Class<T> type, Duration timeout) {
        ensureAccepting("get service '" + name + "'");
        Object instance = resolve(name, timeout, new ArrayDeque<>());
        ServiceSlot<?> slot = slot(name);
        return new ServiceHandle<>(name, type.cast(instance), slot.references(), this::isAccepting);
    }

    private Object resolve(String name, Duration timeout, Deque<String> path) {
        ServiceSlot<?> slot = slot(name);
        if (slot.lazy().state() == LazyOnce.State.READY) {
            return slot.lazy().get(timeout);
        }
        ServiceState current = slot.state();
        if (current == ServiceState.SHUTTING_DOWN || current == ServiceState.STOPPED) {
            throw new ShutdownInProgressException("Service '" + name + "' is " + current);
        }
        if (path.contains(name)) {
            throw new IllegalStateException("Dependency cycle: " + cycleText(path, name));
        }
        path.addLast(name);
        try {
            for (String dep : slot.descriptor().dependencies()) {
                try {
                    resolve(dep, timeout, path);
                } catch (InitializationException e) {
                    throw new InitializationException(name, "dependency '" + dep + "' failed: " + e.getMessage());
                }
            }
        } finally {
            path.removeLast();
        }
        return slot.lazy().get(timeout);
    }

    private <T> T construct(ServiceDescriptor<T> descriptor) throws Exception {
        return descriptor.factory().create(new Context(descriptor));
    }

    // -- status --

    /** Every registered service and its state, in phase then registration order. */
    public Map<String, ServiceState> status() {
        Map<String, ServiceState> out = new LinkedHashMap<>();
        for (ServiceSlot<?> slot : ordered()) {
            out.put(slot.name(), slot.state());
        }
        return out;
    }

    public ServiceState state(String name) {
        return slot(name).state();
    }

    public ManagerState managerState() {
        return state.get();
    }

    public List<ServiceDescriptor<?>> descriptors() {
        List<ServiceDescriptor<?>> out = new ArrayList<>();
        for (ServiceSlot<?> slot : ordered()) {
            out.add(slot.descriptor());
        }
        return out;
    }

    /** Number of open handles for the service. */
    public int references(String name) {
        return slot(name).references().get();
    }

    /**
     * Returns a failed service to {@link ServiceState#UNINITIALIZED} so the next
     * {@link #getService} retries construction.
     *
     * @return {@code false} if the service was not {@link ServiceState#FAILED}
     */
    public boolean reset(String name) {
        ensureAccepting("reset service '" + name + "'");
        boolean reset = slot(name).lazy().reset();
        if (reset) {
            log.infof("Service '%s' reset for retry", name);
        }
        return reset;
    }

    public boolean isAccepting() {
        ManagerState s = state.get();
        return s != ManagerState.SHUTTING_DOWN && s != ManagerState.STOPPED;
    }

    // -- shutdown --

    /**
     * Stops every service in reverse phase order, then the task supervisor,
     * the pools and the caches. Idempotent; cleanup failures are logged and
     * do not stop the remaining teardown.
     */
    public void shutdownAll() {
        synchronized (shutdownLock) {
            ManagerState previous = state.getAndSet(ManagerState.SHUTTING_DOWN);
            if (previous == ManagerState.SHUTTING_DOWN || previous == ManagerState.STOPPED) {
                state.set(previous);
                return;
            }
            log.infof("Shutting down %d services", slots.size());

            List<ServiceSlot<?>> reverse = new ArrayList<>(ordered());
            Collections.reverse(reverse);
            for (ServiceSlot<?> slot : reverse) {
                stop(slot);
            }

            int leaked = tasks.shutdown();
            if (leaked > 0) {
                log.warnf("%d background tasks did not stop in time", leaked);
            }
            pools.closeAll();
            caches.invalidateAll();
            startupExecutor.shutdownNow();

            state.set(ManagerState.STOPPED);
            log.info("Shutdown complete");
        }
    }

    @Override
    public void close() {
        shutdownAll();
    }

    private <T> void stop(ServiceSlot<T> slot) {
        ServiceState before = slot.state();
        slot.markTeardown(ServiceState.SHUTTING_DOWN);
        onTransition(slot.name(), before, ServiceState.SHUTTING_DOWN, null);

        int stillRunning = tasks.cancelScope(slot.name());
        if (stillRunning > 0) {
            log.warnf("Service '%s': %d tasks did not stop within the grace period", slot.name(), stillRunning);
        }
        LazyOnce.State settled = awaitConstruction(slot);
        if (settled == LazyOnce.State.INITIALIZING) {
            log.warnf("Service '%s' still initializing after %s; it is cleaned up when construction finishes",
                    slot.name(), settings.initTimeout());
        }
        slot.lazy().peek().ifPresent(slot::cleanup);
        int open = slot.references().get();
        if (open > 0) {
            log.debugf("Service '%s' stopped with %d open handles", slot.name(), open);
        }
        slot.markTeardown(ServiceState.STOPPED);
        onTransition(slot.name(), ServiceState.SHUTTING_DOWN, ServiceState.STOPPED, null);
    }

    private LazyOnce.State awaitConstruction(ServiceSlot<?> slot) {
        try {
            return slot.lazy().awaitSettled(settings.initTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnf("Interrupted waiting for service '%s' to finish initializing", slot.name());
            return slot.lazy().state();
        }
    }

    // -- internals --

    private void onTransition(String name, ServiceState from, ServiceState to, Throwable failure) {
        if (from == to) {
            return;
        }
        if (to == ServiceState.FAILED) {
            log.errorf("Service '%s': %s -> %s (%s)", name, from, to,
                    failure != null ? failure.getMessage() : "unknown cause");
        } else {
            log.infof("Service '%s': %s -> %s", name, from, to);
        }
        events.publish(EventKind.SERVICE_STATE_CHANGED, name, from + " -> " + to);
        if (to == ServiceState.READY) {
            events.publish(EventKind.SERVICE_READY, name, "");
        } else if (to == ServiceState.FAILED) {
            events.publish(BackboneEvent.of(EventKind.SERVICE_FAILED, name,
                    failure != null && failure.getMessage() != null ? failure.getMessage() : ""));
        }
    }

    private ServiceSlot<?> slot(String name) {
        ServiceSlot<?> slot = slots.get(name);
        if (slot == null) {
            throw new ServiceNotFoundException(name);
        }
        return slot;
    }

    private List<ServiceSlot<?>> ordered() {
        List<ServiceSlot<?>> list = new ArrayList<>(slots.values());
        list.sort(Comparator.<ServiceSlot<?>>comparingInt(s -> s.descriptor().phase())
                .thenComparingInt(ServiceSlot::order));
        return list;
    }

    private TreeMap<Integer, List<ServiceSlot<?>>> phases() {
        TreeMap<Integer, List<ServiceSlot<?>>> phases = new TreeMap<>();
        for (ServiceSlot<?> slot : ordered()) {
            phases.computeIfAbsent(slot.descriptor().phase(), p -> new ArrayList<>()).add(slot);
        }
        return phases;
    }

    private void ensureAccepting(String operation) {
        if (!isAccepting()) {
            throw new ShutdownInProgressException("Cannot " + operation + ": shutdown in progress");
        }
    }

    private static List<String> names(List<ServiceSlot<?>> slots) {
        return slots.stream().map(ServiceSlot::name).collect(Collectors.toList());
    }

    private static String cycleText(Deque<String> path, String repeated) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String n : path) {
            inCycle |= n.equals(repeated);
            if (inCycle) {
                cycle.add(n);
            }
        }
        cycle.add(repeated);
        return String.join(" -> ", cycle);
    }

    /** Dependency access limited to what the service declared. */
    private final class Context implements ServiceContext {

        private final ServiceDescriptor<?> descriptor;
        private final Map<String, Object> resolved = new HashMap<>();

        Context(ServiceDescriptor<?> descriptor) {
            this.descriptor = descriptor;
        }

        @Override
        public String serviceName() {
            return descriptor.name();
        }

        @Override
        public <D> D dependency(String name, Class<D> type) {
            if (!descriptor.dependencies().contains(name)) {
                throw new IllegalArgumentException("Service '" + descriptor.name()
                        + "' did not declare a dependency on '" + name + "'");
            }
            Object instance = resolved.computeIfAbsent(name,
                    n -> resolve(n, settings.initTimeout(), new ArrayDeque<>()));
            return type.cast(instance);
        }

        @Override
        public PoolRegistry pools() {
            return pools;
        }

        @Override
        public CacheManager caches() {
            return caches;
        }

        @Override
        public RateLimiter rateLimiter() {
            return rateLimiter;
        }

        @Override
        public TaskSupervisor tasks() {
            return tasks;
        }

        @Override
        public EventBus events() {
            return events;
        }

        @Override
        public TaskBuilder task(String taskName) {
            return tasks.task(taskName).scope(descriptor.name());
        }
    }

    private static final class StartupThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "backbone-startup-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
