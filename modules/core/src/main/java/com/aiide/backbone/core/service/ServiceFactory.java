package com.aiide.backbone.core.service;

/**
 * Builds a service instance. Called at most once per successful initialization.
 */
@FunctionalInterface
public interface ServiceFactory<T> {

    T create(ServiceContext context) throws Exception;
}
