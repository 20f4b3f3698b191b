package com.aiide.backbone.core.service;

@FunctionalInterface
public interface ServiceRegistrar {

    void register(ServiceDescriptor<?> descriptor);
}
