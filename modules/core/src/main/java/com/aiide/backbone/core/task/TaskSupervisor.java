package com.aiide.backbone.core.task;

import com.aiide.backbone.core.ShutdownInProgressException;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.event.EventKind;
import com.aiide.backbone.util.Durations;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs tracked background tasks, each with a mandatory cleanup that runs
 * exactly once however the task ends: success, failure, cancellation, scope
 * teardown or supervisor shutdown.
 * <p>
 * Cancellation is cooperative. {@link #cancel(long)} sets the task's token and
 * interrupts its worker so blocking calls wake up, then waits for the cleanup.
 * A task's record leaves the active set only after its cleanup has returned.
 * On {@link #shutdown()} tasks that do not finish within the grace period are
 * reported as {@link TaskStatus#LEAKED}; the process is never aborted.
 */
public class TaskSupervisor implements AutoCloseable {

    private static final Logger log = Logger.getLogger(TaskSupervisor.class);

    public static final String DEFAULT_SCOPE = "global";

    private final TaskSettings settings;
    private final EventBus events;
    private final ExecutorService executor;
    private final CancellationToken root = new CancellationToken();
    private final AtomicLong ids = new AtomicLong();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();
    private final Map<Long, SupervisedTask> active = new ConcurrentHashMap<>();
    private final Deque<TaskRecord> history = new ArrayDeque<>();

    public TaskSupervisor(TaskSettings settings, EventBus events) {
        this.settings = settings;
        this.events = events;
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    public TaskBuilder task(String name) {
        return new TaskBuilder(this, name);
    }

    public TaskHandle spawn(String name, TaskBody body, TaskCleanup cleanup) {
        return task(name).cleanup(cleanup).start(body);
    }

    /**
     * Requests cancellation and waits up to the grace timeout for the task's
     * cleanup. Called from the task's own thread it only signals.
     *
     * @return true if the task has stopped and cleaned up (or was not running)
     */
    public boolean cancel(long taskId) {
        SupervisedTask task = active.get(taskId);
        if (task == null) {
            return true;
        }
        task.token().cancel();
        task.interrupt();
        if (task.runsOn(Thread.currentThread())) {
            return false;
        }
        return awaitStopped(task, Durations.deadline(System.nanoTime(), settings.shutdownGraceTimeout()));
    }

    /**
     * Cancels every task in {@code scope} and waits for their cleanups.
     *
     * @return number of tasks that did not stop within the grace timeout
     */
    public int cancelScope(String scope) {
        List<SupervisedTask> inScope = new ArrayList<>();
        for (SupervisedTask task : active.values()) {
            if (task.scope().equals(scope)) {
                inScope.add(task);
            }
        }
        return cancelAndAwait(inScope);
    }

    /**
     * Rejects new work, cancels every running task and waits up to the grace
     * timeout. Tasks still running afterwards are logged and published as leaked.
     *
     * @return number of leaked tasks
     */
    public int shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return 0;
        }
        List<SupervisedTask> outstanding = new ArrayList<>(active.values());
        log.infof("Task supervisor shutting down, %d task(s) outstanding", outstanding.size());
        root.cancel();
        int leaked = cancelAndAwait(outstanding);
        executor.shutdown();
        if (leaked > 0) {
            log.warnf("Task supervisor stopped with %d leaked task(s)", leaked);
        } else {
            log.info("Task supervisor stopped");
        }
        return leaked;
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public Optional<TaskRecord> find(long taskId) {
        SupervisedTask task = active.get(taskId);
        if (task != null) {
            return Optional.of(task.snapshot());
        }
        synchronized (history) {
            return history.stream().filter(r -> r.id() == taskId).findFirst();
        }
    }

    public List<TaskRecord> activeTasks() {
        List<TaskRecord> records = new ArrayList<>();
        for (SupervisedTask task : active.values()) {
            records.add(task.snapshot());
        }
        records.sort(Comparator.comparingLong(TaskRecord::id));
        return records;
    }

    public List<TaskRecord> finishedTasks() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public int activeCount() {
        return active.size();
    }

    TaskHandle start(String name, String scope, TaskBody body, TaskCleanup cleanup) {
        if (shuttingDown.get()) {
            throw new ShutdownInProgressException("Task supervisor is shutting down; rejected '" + name + "'");
        }
        SupervisedTask task = new SupervisedTask(ids.incrementAndGet(), name, scope, root.child(), cleanup);
        active.put(task.id(), task);
        try {
            executor.execute(() -> execute(task, body));
        } catch (RejectedExecutionException e) {
            task.token().cancel();
            finish(task, TaskStatus.CANCELLED, null);
            throw new ShutdownInProgressException("Task supervisor is shutting down; rejected '" + name + "'");
        }
        log.debugf("Task %d (%s) spawned in scope '%s'", task.id(), name, scope);
        return new TaskHandle(task, this);
    }

    private void execute(SupervisedTask task, TaskBody body) {
        task.bind(Thread.currentThread());
        TaskStatus outcome = TaskStatus.COMPLETED;
        Throwable failure = null;
        try {
            task.token().checkpoint();
            body.run(task.token());
            if (task.token().isCancelled()) {
                outcome = TaskStatus.CANCELLED;
            }
        } catch (Throwable t) {
            if (isCancellation(t, task)) {
                outcome = TaskStatus.CANCELLED;
            } else {
                outcome = TaskStatus.FAILED;
                failure = t;
            }
        }
        task.unbind();
        // a cancel racing with the end of the body may have left the flag set
        Thread.interrupted();

        finish(task, outcome, failure);
        if (failure instanceof Error error) {
            throw error;
        }
    }

    private void finish(SupervisedTask task, TaskStatus outcome, Throwable failure) {
        boolean wasLeaked = task.snapshot().status() == TaskStatus.LEAKED;
        task.finish(outcome, failure == null ? null : TaskError.from(failure));
        TaskRecord record = task.snapshot();
        try {
            task.cleanup().cleanup(record);
        } catch (Exception e) {
            log.errorf(e, "Cleanup of task %d (%s) failed", task.id(), task.name());
        } finally {
            active.remove(task.id());
            remember(record);
            task.done().complete(record);
        }

        if (wasLeaked) {
            log.warnf("Task %d (%s) finished after being reported leaked", task.id(), task.name());
        }
        switch (outcome) {
            case FAILED:
                log.errorf(failure, "Task %d (%s) failed", task.id(), task.name());
                events.publish(EventKind.TASK_FAILED, task.name(),
                        "task " + task.id() + ": " + record.error().message());
                break;
            case CANCELLED:
                log.debugf("Task %d (%s) cancelled", task.id(), task.name());
                events.publish(EventKind.TASK_CANCELLED, task.name(), "task " + task.id());
                break;
            default:
                log.debugf("Task %d (%s) completed", task.id(), task.name());
        }
    }

    private int cancelAndAwait(List<SupervisedTask> tasks) {
        for (SupervisedTask task : tasks) {
            task.token().cancel();
            task.interrupt();
        }
        long deadline = Durations.deadline(System.nanoTime(), settings.shutdownGraceTimeout());
        int notStopped = 0;
        for (SupervisedTask task : tasks) {
            if (task.runsOn(Thread.currentThread())) {
                continue;
            }
            if (!awaitStopped(task, deadline)) {
                notStopped++;
                if (shuttingDown.get()) {
                    reportLeak(task);
                }
            }
        }
        return notStopped;
    }

    private boolean awaitStopped(SupervisedTask task, long deadline) {
        try {
            task.done().get(Durations.remainingNanos(deadline, System.nanoTime()), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warnf("Task %d (%s) did not stop within %s", task.id(), task.name(), settings.shutdownGraceTimeout());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    private void reportLeak(SupervisedTask task) {
        task.markLeaked();
        TaskRecord record = task.snapshot();
        if (record.status() != TaskStatus.LEAKED) {
            return;
        }
        log.warnf("Task %d (%s) leaked: cleanup did not finish within %s",
                task.id(), task.name(), settings.shutdownGraceTimeout());
        remember(record);
        events.publish(EventKind.TASK_LEAKED, task.name(), "task " + task.id());
    }

    private void remember(TaskRecord record) {
        if (settings.historySize() == 0) {
            return;
        }
        synchronized (history) {
            history.removeIf(r -> r.id() == record.id());
            history.addLast(record);
            while (history.size() > settings.historySize()) {
                history.removeFirst();
            }
        }
    }

    private static boolean isCancellation(Throwable t, SupervisedTask task) {
        if (t instanceof TaskCancelledException) {
            return true;
        }
        return task.token().isCancelled() && t instanceof InterruptedException;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "backbone-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
