package com.craftplane.api.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * 插件分类（封闭枚举）
 * 是否需要重启服务器由各常量自身声明，不做运行时类型探测
 */
public enum PluginCategory {

    GAMEPLAY(false),
    ADMIN(false),
    ECONOMY(false),
    CHAT(false),
    WORLD(true),
    PERFORMANCE(true),
    UTILITY(false);

    private final boolean restartRequired;

    PluginCategory(boolean restartRequired) {
        this.restartRequired = restartRequired;
    }

    public boolean requiresRestart() {
        return restartRequired;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PluginCategory fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Plugin category cannot be blank");
        }
        return Arrays.stream(values())
                .filter(c -> c.code().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown plugin category: " + code));
    }
}
