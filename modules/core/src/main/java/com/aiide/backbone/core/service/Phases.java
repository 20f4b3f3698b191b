package com.aiide.backbone.core.service;

/**
 * Well-known startup phases. Any int works; lower phases start first and stop last.
 */
public final class Phases {

    public static final int CORE_STORAGE = 10;
    public static final int NETWORKING = 20;
    public static final int AI_LSP = 30;
    public static final int WEBHOOKS = 40;

    private Phases() {
    }
}
