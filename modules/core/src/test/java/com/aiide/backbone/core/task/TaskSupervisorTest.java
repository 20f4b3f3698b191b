package com.aiide.backbone.core.task;

import com.aiide.backbone.core.ShutdownInProgressException;
import com.aiide.backbone.core.event.BackboneEvent;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.event.EventKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskSupervisorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final EventBus events = new EventBus();
    private final List<BackboneEvent> published = new CopyOnWriteArrayList<>();
    private final TaskSupervisor supervisor = new TaskSupervisor(new TaskSettings(Duration.ofSeconds(2), 16), events);

    @BeforeEach
    void setUp() {
        events.subscribeAll(published::add);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    @Test
    void cleanupRunsOnceAfterSuccess() throws Exception {
        AtomicInteger cleanups = new AtomicInteger();
        AtomicReference<TaskStatus> seen = new AtomicReference<>();

        TaskHandle handle = supervisor.spawn("echo", token -> { }, record -> {
            cleanups.incrementAndGet();
            seen.set(record.status());
        });
        TaskRecord record = handle.join(WAIT);

        assertThat(record.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(cleanups).hasValue(1);
        assertThat(seen.get()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(supervisor.activeCount()).isZero();
        assertThat(supervisor.find(handle.taskId())).get()
                .extracting(TaskRecord::status).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void failureIsRecordedAndPublished() throws Exception {
        AtomicInteger cleanups = new AtomicInteger();

        TaskHandle handle = supervisor.spawn("indexer", token -> {
            throw new IllegalStateException("disk full");
        }, record -> cleanups.incrementAndGet());

        assertThatThrownBy(() -> handle.join(WAIT))
                .isInstanceOf(TaskFailedException.class)
                .hasMessageContaining("disk full");
        TaskRecord record = handle.await(WAIT);
        assertThat(record.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(record.error().exceptionType()).isEqualTo(IllegalStateException.class.getName());
        assertThat(cleanups).hasValue(1);
        assertThat(published).extracting(BackboneEvent::kind).contains(EventKind.TASK_FAILED);
    }

    @Test
    void cancelWakesABlockedTaskAndWaitsForCleanup() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch cleanedUp = new CountDownLatch(1);

        TaskHandle handle = supervisor.task("watcher")
                .cleanup(record -> cleanedUp.countDown())
                .start(token -> {
                    running.countDown();
                    Thread.sleep(60_000);
                });
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(handle.cancel()).isTrue();

        assertThat(cleanedUp.getCount()).isZero();
        assertThat(handle.isDone()).isTrue();
        assertThat(handle.snapshot().status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(handle.snapshot().cancellationRequested()).isTrue();
        assertThat(supervisor.activeTasks()).isEmpty();
    }

    @Test
    void cooperativeCheckpointEndsTheTaskAsCancelled() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        TaskHandle handle = supervisor.spawn("poller", token -> {
            running.countDown();
            while (true) {
                token.checkpoint();
                Thread.onSpinWait();
            }
        }, TaskCleanup.NONE);
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        handle.cancel();

        assertThatThrownBy(() -> handle.join(WAIT)).isInstanceOf(TaskCancelledException.class);
        assertThat(published).extracting(BackboneEvent::kind).contains(EventKind.TASK_CANCELLED);
    }

    @Test
    void cancelScopeOnlyTouchesThatScope() throws Exception {
        CountDownLatch running = new CountDownLatch(2);
        TaskBody blocking = token -> {
            running.countDown();
            Thread.sleep(60_000);
        };
        TaskHandle lsp = supervisor.task("lsp-reader").scope("lsp").cleanup(TaskCleanup.NONE).start(blocking);
        TaskHandle hooks = supervisor.task("webhook-retry").scope("webhooks").cleanup(TaskCleanup.NONE).start(blocking);
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(supervisor.cancelScope("lsp")).isZero();

        assertThat(lsp.isDone()).isTrue();
        assertThat(hooks.isDone()).isFalse();
        hooks.cancel();
    }

    @Test
    void cleanupFailureDoesNotLoseTheRecord() throws Exception {
        TaskHandle handle = supervisor.spawn("flaky-cleanup", token -> { }, record -> {
            throw new IllegalStateException("close failed");
        });

        assertThat(handle.await(WAIT).status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(supervisor.activeCount()).isZero();
    }

    @Test
    void shutdownReportsTasksThatIgnoreCancellation() throws Exception {
        TaskSupervisor impatient = new TaskSupervisor(new TaskSettings(Duration.ofMillis(100), 16), events);
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger cleanups = new AtomicInteger();

        TaskHandle stubborn = impatient.spawn("stubborn", token -> {
            running.countDown();
            while (true) {
                try {
                    if (release.await(10, TimeUnit.SECONDS)) {
                        return;
                    }
                } catch (InterruptedException ignored) {
                    // keeps running on purpose
                }
            }
        }, record -> cleanups.incrementAndGet());
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(impatient.shutdown()).isEqualTo(1);

        assertThat(published).extracting(BackboneEvent::kind).contains(EventKind.TASK_LEAKED);
        assertThat(impatient.finishedTasks()).extracting(TaskRecord::status).contains(TaskStatus.LEAKED);
        assertThat(cleanups).hasValue(0);

        release.countDown();
        stubborn.await(WAIT);
        assertThat(cleanups).hasValue(1);
    }

    @Test
    void shutdownRejectsNewWork() {
        assertThat(supervisor.shutdown()).isZero();

        assertThatThrownBy(() -> supervisor.spawn("late", token -> { }, TaskCleanup.NONE))
                .isInstanceOf(ShutdownInProgressException.class);
        assertThat(supervisor.isShuttingDown()).isTrue();
    }

    @Test
    void childTokensFollowTheirParent() {
        CancellationToken parent = new CancellationToken();
        CancellationToken child = parent.child();
        CancellationToken sibling = parent.child();

        child.cancel();
        assertThat(parent.isCancelled()).isFalse();
        assertThat(sibling.isCancelled()).isFalse();

        parent.cancel();
        assertThat(sibling.isCancelled()).isTrue();
        assertThatThrownBy(sibling::checkpoint).isInstanceOf(TaskCancelledException.class);
    }

    @Test
    void historyIsBounded() throws Exception {
        TaskSupervisor small = new TaskSupervisor(new TaskSettings(Duration.ofSeconds(1), 2), events);
        try {
            for (int i = 0; i < 5; i++) {
                small.spawn("t" + i, token -> { }, TaskCleanup.NONE).await(WAIT);
            }
            assertThat(small.finishedTasks()).extracting(TaskRecord::name).containsExactly("t3", "t4");
        } finally {
            small.shutdown();
        }
    }
}
