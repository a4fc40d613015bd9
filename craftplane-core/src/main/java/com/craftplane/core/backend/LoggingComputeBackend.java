package com.craftplane.core.backend;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.api.model.ServerInstance;
import com.craftplane.core.install.UninstallOptions;
import com.craftplane.core.spi.ComputeBackend;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 默认计算平台实现：只记录日志，不触碰真实服务器
 */
@Slf4j
public class LoggingComputeBackend implements ComputeBackend {

    @Override
    public void stagePlugin(ServerInstance server, PluginPackage plugin) {
        log.info("[{}] Staging plugin {}", server.getId(), plugin.getUniqueKey());
    }

    @Override
    public void installPlugin(ServerInstance server, PluginPackage plugin) {
        log.info("[{}] Activating plugin {}", server.getId(), plugin.getUniqueKey());
    }

    @Override
    public void removePlugin(ServerInstance server, PluginPackage plugin, UninstallOptions options) {
        log.info("[{}] Removing plugin {} (removeConfig={}, removeData={})",
                server.getId(), plugin.getUniqueKey(), options.isRemoveConfig(), options.isRemoveData());
    }

    @Override
    public void applyConfiguration(ServerInstance server, PluginPackage plugin, Map<String, Object> config) {
        log.info("[{}] Applying {} config entries to {}", server.getId(), config.size(), plugin.getUniqueKey());
    }
}
