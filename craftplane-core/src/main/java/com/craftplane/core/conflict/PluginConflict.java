package com.craftplane.core.conflict;

import com.craftplane.api.model.PluginPackage;

/**
 * 两个插件之间的冲突
 *
 * @param firstLabel  "name vX" 形式的展示名
 */
public record PluginConflict(ConflictType type,
                             String firstPluginId, String firstLabel,
                             String secondPluginId, String secondLabel,
                             String description, ConflictSeverity severity) {

    public static PluginConflict between(ConflictType type, PluginPackage first, PluginPackage second,
                                         String description, ConflictSeverity severity) {
        return new PluginConflict(type, first.getId(), label(first), second.getId(), label(second),
                description, severity);
    }

    private static String label(PluginPackage plugin) {
        return plugin.getName() + " v" + plugin.getVersion();
    }
}
