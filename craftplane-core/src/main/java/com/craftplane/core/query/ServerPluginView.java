package com.craftplane.core.query;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.api.model.ServerPluginInstallation;

/**
 * @param plugin 目录中已不存在时为 null
 */
public record ServerPluginView(ServerPluginInstallation installation, PluginPackage plugin) {

    public boolean isEnabled() {
        return installation.isInstalled();
    }
}
