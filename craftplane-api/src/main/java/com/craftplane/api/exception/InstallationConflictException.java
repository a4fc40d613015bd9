package com.craftplane.api.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 生命周期冲突：重复安装、安装进行中、被依赖阻止卸载等
 */
@Getter
public class InstallationConflictException extends CraftPlaneException {

    private final String serverId;
    private final String pluginId;

    // 阻止卸载的依赖方插件名（仅 DEPENDENCY_BLOCKED 时非空）
    private final List<String> blockingPlugins;

    public InstallationConflictException(ReasonCode reason, String serverId, String pluginId, String message) {
        this(reason, serverId, pluginId, Collections.emptyList(), message);
    }

    public InstallationConflictException(ReasonCode reason, String serverId, String pluginId,
                                         List<String> blockingPlugins, String message) {
        super(reason, message);
        this.serverId = serverId;
        this.pluginId = pluginId;
        this.blockingPlugins = List.copyOf(blockingPlugins);
    }
}
