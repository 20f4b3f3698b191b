package com.aiide.backbone.core.pool;

@FunctionalInterface
public interface LeaseFunction<T, R> {

    R apply(T resource) throws Exception;
}
