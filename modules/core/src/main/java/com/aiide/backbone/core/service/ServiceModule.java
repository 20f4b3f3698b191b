package com.aiide.backbone.core.service;

/**
 * Contributes service descriptors. Implementations are CDI beans; every one
 * found at application startup is asked to register its services before the
 * first phase starts.
 */
public interface ServiceModule {

    void register(ServiceRegistrar registrar);
}
