package com.aiide.backbone.test;

import com.aiide.backbone.core.service.LifecycleManager;
import com.aiide.backbone.core.service.ServiceHandle;
import com.aiide.backbone.core.service.ServiceState;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class LifecycleBootstrapTest {

    @Inject
    LifecycleManager lifecycle;

    @Test
    void modulesAreInstalledAndStartedAtStartup() {
        assertThat(lifecycle.managerState()).isEqualTo(LifecycleManager.ManagerState.RUNNING);
        assertThat(lifecycle.state(TestServiceModule.STORE)).isEqualTo(ServiceState.READY);
        assertThat(lifecycle.state(TestServiceModule.ASSISTANT)).isEqualTo(ServiceState.READY);
    }

    @Test
    void optionalFailureDoesNotBlockStartup() {
        assertThat(lifecycle.state(TestServiceModule.TELEMETRY)).isEqualTo(ServiceState.FAILED);
    }

    @Test
    void dependentSeesTheSameInstanceAsEveryoneElse() {
        try (ServiceHandle<TestServiceModule.TestAssistant> assistant =
                     lifecycle.getService(TestServiceModule.ASSISTANT, TestServiceModule.TestAssistant.class);
             ServiceHandle<TestServiceModule.TestStore> store =
                     lifecycle.getService(TestServiceModule.STORE, TestServiceModule.TestStore.class)) {
            assertThat(assistant.get().store()).isSameAs(store.get());
            assertThat(store.get().connections()).isEqualTo(8);
        }
    }
}
