package com.craftplane.core.conflict;

import java.util.Locale;

public enum ConflictType {
    DUPLICATE,
    RESOURCE,
    DEPENDENCY,
    INCOMPATIBLE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
