package com.aiide.backbone.core.service;

import com.aiide.backbone.core.cache.CacheManager;
import com.aiide.backbone.core.cache.CacheSettings;
import com.aiide.backbone.core.event.EventBus;
import com.aiide.backbone.core.pool.PoolRegistry;
import com.aiide.backbone.core.pool.PoolSettings;
import com.aiide.backbone.core.ratelimit.RateLimitSettings;
import com.aiide.backbone.core.ratelimit.RateLimiter;
import com.aiide.backbone.core.task.TaskSettings;
import com.aiide.backbone.core.task.TaskSupervisor;
import com.aiide.backbone.util.ManualTicker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.entry;

class LifecycleBootstrapStartupTest {

    private LifecycleManager lifecycle;
    private LifecycleBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        ManualTicker ticker = new ManualTicker();
        EventBus events = new EventBus();
        lifecycle = new LifecycleManager(new LifecycleSettings(Duration.ofSeconds(5), Duration.ofSeconds(5)),
                events,
                new TaskSupervisor(new TaskSettings(Duration.ofSeconds(1), 16), events),
                new PoolRegistry(PoolSettings.defaults(), ticker, events),
                new CacheManager(CacheSettings.defaults(), ticker, events),
                new RateLimiter(RateLimitSettings.defaults(), ticker, events));
        bootstrap = new LifecycleBootstrap();
        bootstrap.lifecycle = lifecycle;
        bootstrap.autoStart = true;
    }

    @AfterEach
    void tearDown() {
        lifecycle.shutdownAll();
    }

    @Test
    void failedRequiredServiceLeavesApplicationRunning() {
        ServiceModule module = registrar -> {
            registrar.register(ServiceDescriptor.builder("db", Object.class)
                    .phase(Phases.CORE_STORAGE)
                    .factory(ctx -> {
                        throw new IllegalStateException("connection refused");
                    })
                    .build());
            registrar.register(ServiceDescriptor.builder("ai", Object.class)
                    .phase(Phases.AI_LSP)
                    .dependsOn("db")
                    .factory(ctx -> ctx.dependency("db", Object.class))
                    .build());
        };

        assertThatCode(() -> bootstrap.start(List.of(module))).doesNotThrowAnyException();

        assertThat(lifecycle.managerState()).isEqualTo(LifecycleManager.ManagerState.START_FAILED);
        assertThat(lifecycle.isAccepting()).isTrue();
        assertThat(lifecycle.status()).containsExactly(
                entry("db", ServiceState.FAILED),
                entry("ai", ServiceState.UNINITIALIZED));
    }

    @Test
    void autoStartOffOnlyInstallsModules() {
        bootstrap.autoStart = false;
        ServiceModule module = registrar -> registrar.register(
                ServiceDescriptor.builder("db", Object.class).factory(ctx -> new Object()).build());

        bootstrap.start(List.of(module));

        assertThat(lifecycle.status()).containsExactly(entry("db", ServiceState.UNINITIALIZED));
        assertThat(lifecycle.managerState()).isEqualTo(LifecycleManager.ManagerState.CREATED);
    }
}
