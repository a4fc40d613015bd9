package com.craftplane.core.compat;

public enum ResourceConflictType {
    DUPLICATE,
    COMMAND
}
