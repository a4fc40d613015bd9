package com.craftplane.core.compat;

import java.util.Locale;

public enum DependencyStatus {
    SATISFIED,
    MISSING,
    OUTDATED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
