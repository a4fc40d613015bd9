package com.craftplane.core.spi;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.api.model.ServerInstance;
import com.craftplane.core.install.UninstallOptions;

import java.util.Map;

/**
 * 计算平台 SPI
 * 真正修改运行中服务器的文件系统和配置，所有方法在安装任务线程中调用，失败直接抛异常。
 */
public interface ComputeBackend {

    /**
     * 将插件制品准备到服务器可访问的位置
     */
    void stagePlugin(ServerInstance server, PluginPackage plugin);

    /**
     * 激活已准备好的插件
     */
    void installPlugin(ServerInstance server, PluginPackage plugin);

    void removePlugin(ServerInstance server, PluginPackage plugin, UninstallOptions options);

    /**
     * 将配置覆盖项应用到运行中的实例
     */
    void applyConfiguration(ServerInstance server, PluginPackage plugin, Map<String, Object> config);
}
