package com.craftplane.core.conflict;

import java.util.Locale;

public enum RecommendationType {
    REMOVE,
    REPLACE,
    UPDATE,
    CONFIGURE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
