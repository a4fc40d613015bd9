package com.craftplane.core.compat;

public record ResourceConflict(ResourceConflictType type, String conflictingPluginId, String description) {
}
