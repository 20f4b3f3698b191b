package com.aiide.backbone.core.service;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Installs every {@link ServiceModule} bean at application startup, starts
 * all phases when auto-start is on, and shuts everything down with the
 * application. A failed startup is logged and leaves the application running
 * with the failure visible through {@link LifecycleManager#status()}.
 */
@ApplicationScoped
public class LifecycleBootstrap {

    private static final Logger log = Logger.getLogger(LifecycleBootstrap.class);

    @Inject
    LifecycleManager lifecycle;

    @Inject
    Instance<ServiceModule> modules;

    @ConfigProperty(name = "backbone.lifecycle.auto-start", defaultValue = "true")
    boolean autoStart;

    void onStart(@Observes StartupEvent event) {
        start(modules);
    }

    void start(Iterable<? extends ServiceModule> serviceModules) {
        int installed = 0;
        for (ServiceModule module : serviceModules) {
            lifecycle.install(module);
            installed++;
        }
        log.infof("Installed %d service modules: %s", installed, lifecycle.status().keySet());

        if (!autoStart) {
            log.info("Auto-start disabled; services initialize on first use");
            return;
        }
        try {
            lifecycle.startAll();
        } catch (RuntimeException e) {
            // the application stays up; readiness reports DOWN until the service is reset
            log.errorf(e, "Service startup failed, running degraded: %s", lifecycle.status());
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        lifecycle.shutdownAll();
    }
}
