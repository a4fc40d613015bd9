package com.craftplane.core.audit;

public enum AuditAction {
    PLUGIN_INSTALLED,
    PLUGIN_UNINSTALLED,
    PLUGIN_UPDATED,
    PLUGIN_CONFIGURED
}
