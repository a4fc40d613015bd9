package com.craftplane.api.exception;

import lombok.Getter;

@Getter
public class PluginNotFoundException extends CraftPlaneException {

    private final String pluginId;

    public PluginNotFoundException(String pluginId) {
        super(ReasonCode.PLUGIN_NOT_FOUND, "Plugin not found: " + pluginId);
        this.pluginId = pluginId;
    }

    /**
     * 按名称+版本查找失败
     */
    public static PluginNotFoundException version(String name, String version) {
        return new PluginNotFoundException(ReasonCode.VERSION_NOT_FOUND, name + "@" + version,
                "Plugin " + name + " has no version " + version);
    }

    private PluginNotFoundException(ReasonCode reason, String pluginId, String message) {
        super(reason, message);
        this.pluginId = pluginId;
    }
}
