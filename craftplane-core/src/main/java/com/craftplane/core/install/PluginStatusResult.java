package com.craftplane.core.install;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.api.model.ServerPluginInstallation;
import com.craftplane.core.compat.DependencyStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * 单个插件在服务器上的运行状态
 */
@Getter
@Builder
@ToString
public class PluginStatusResult {

    private final ServerPluginInstallation installation;
    private final PluginPackage plugin;
    private final boolean loaded;
    private final boolean enabled;

    // 依赖名 -> 满足情况
    private final Map<String, DependencyStatus> dependencyStatus;

    private final String latestVersion;
    private final boolean updateAvailable;
}
