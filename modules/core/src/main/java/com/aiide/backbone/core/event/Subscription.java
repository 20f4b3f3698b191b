package com.aiide.backbone.core.event;

/**
 * Registration returned by {@link EventBus#subscribe}. Closing it stops delivery.
 */
public interface Subscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
