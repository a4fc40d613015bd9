package com.craftplane.core.conflict;

import java.util.Locale;

public enum ConflictSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
