package com.aiide.backbone.core.event;

@FunctionalInterface
public interface EventListener {

    void onEvent(BackboneEvent event);
}
