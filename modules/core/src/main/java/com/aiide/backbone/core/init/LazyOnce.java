package com.aiide.backbone.core.init;

import com.aiide.backbone.core.BackboneException;
import com.aiide.backbone.core.OperationTimeoutException;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Constructs a value at most once under concurrent first use.
 * <p>
 * The first caller to observe {@link State#UNINITIALIZED} takes the lock,
 * checks the state again, claims {@link State#INITIALIZING} and runs the
 * initializer outside the lock. Every other caller waits on a shared condition
 * until the value is {@link State#READY} or {@link State#FAILED}, or until its
 * own timeout elapses. A failure is cached and rethrown to every later caller
 * until {@link #reset()} is called.
 *
 * @param <T> type of the constructed value
 */
public final class LazyOnce<T> {

    private static final Logger log = Logger.getLogger(LazyOnce.class);

    public enum State { UNINITIALIZED, INITIALIZING, READY, FAILED }

    @FunctionalInterface
    public interface Initializer<T> {
        T initialize() throws Exception;
    }

    /** Notified after every transition, outside the lock. */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(State from, State to, InitializationException failure);
    }

    private final String name;
    private final Initializer<T> initializer;
    private final TransitionListener listener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition settled = lock.newCondition();
    private final AtomicInteger attempts = new AtomicInteger();

    private volatile State state = State.UNINITIALIZED;
    private volatile T value;
    private volatile InitializationException failure;

    public LazyOnce(String name, Initializer<T> initializer) {
        this(name, initializer, (from, to, failure) -> { });
    }

    public LazyOnce(String name, Initializer<T> initializer, TransitionListener listener) {
        this.name = Objects.requireNonNull(name, "name");
        this.initializer = Objects.requireNonNull(initializer, "initializer");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Returns the value, constructing it if this is the first call.
     *
     * @throws InitializationException   if construction failed (now or earlier)
     * @throws OperationTimeoutException if another thread is constructing and it
     *                                   did not settle within {@code timeout}
     */
    public T get(Duration timeout) {
        State current = state;
        if (current == State.READY) {
            return value;
        }
        if (current == State.FAILED) {
            throw failure;
        }

        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (true) {
                switch (state) {
                    case READY:
                        return value;
                    case FAILED:
                        throw failure;
                    case UNINITIALIZED:
                        state = State.INITIALIZING;
                        break;
                    default:
                        if (remaining <= 0) {
                            throw new OperationTimeoutException("waiting for '" + name + "' to initialize", timeout);
                        }
                        remaining = settled.awaitNanos(remaining);
                        continue;
                }
                break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackboneException("Interrupted while waiting for '" + name + "' to initialize", e);
        } finally {
            lock.unlock();
        }

        return construct();
    }

    /** Waits until no construction is in progress and returns the settled state. */
    public State awaitSettled(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (state == State.INITIALIZING && remaining > 0) {
                remaining = settled.awaitNanos(remaining);
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a {@link State#FAILED} value back to {@link State#UNINITIALIZED} so the
     * next {@link #get} retries construction, passing through
     * {@link State#INITIALIZING} as usual.
     *
     * @return false if the value was not failed
     */
    public boolean reset() {
        lock.lock();
        try {
            if (state != State.FAILED) {
                return false;
            }
            state = State.UNINITIALIZED;
            failure = null;
        } finally {
            lock.unlock();
        }
        notifyListener(State.FAILED, State.UNINITIALIZED, null);
        return true;
    }

    public State state() {
        return state;
    }

    public String name() {
        return name;
    }

    public Optional<T> peek() {
        return state == State.READY ? Optional.of(value) : Optional.empty();
    }

    public Optional<InitializationException> failure() {
        return Optional.ofNullable(failure);
    }

    /** Number of times the initializer has been invoked. */
    public int attempts() {
        return attempts.get();
    }

    private T construct() {
        notifyListener(State.UNINITIALIZED, State.INITIALIZING, null);
        attempts.incrementAndGet();

        T created;
        try {
            created = initializer.initialize();
        } catch (InitializationException e) {
            throw fail(e);
        } catch (Exception e) {
            throw fail(new InitializationException(name, e));
        } catch (Error e) {
            // waiters must be released and the failure reported before the Error propagates
            fail(new InitializationException(name, e));
            throw e;
        }
        if (created == null) {
            throw fail(new InitializationException(name, "initializer returned null"));
        }
        settle(created, null);
        notifyListener(State.INITIALIZING, State.READY, null);
        return created;
    }

    private InitializationException fail(InitializationException error) {
        settle(null, error);
        notifyListener(State.INITIALIZING, State.FAILED, error);
        return error;
    }

    private void settle(T created, InitializationException error) {
        lock.lock();
        try {
            if (error != null) {
                failure = error;
                state = State.FAILED;
            } else {
                value = created;
                state = State.READY;
            }
            settled.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void notifyListener(State from, State to, InitializationException error) {
        try {
            listener.onTransition(from, to, error);
        } catch (RuntimeException e) {
            log.warnf(e, "Transition listener for '%s' failed on %s -> %s", name, from, to);
        }
    }
}
