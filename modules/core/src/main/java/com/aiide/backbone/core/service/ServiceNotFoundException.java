package com.aiide.backbone.core.service;

import com.aiide.backbone.core.BackboneException;

public class ServiceNotFoundException extends BackboneException {

    private final String serviceName;

    public ServiceNotFoundException(String serviceName) {
        super("No service registered under '" + serviceName + "'");
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }
}
