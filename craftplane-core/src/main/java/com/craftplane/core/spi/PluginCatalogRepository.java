package com.craftplane.core.spi;

import com.craftplane.api.model.PluginPackage;

import java.util.List;
import java.util.Optional;

/**
 * 插件目录（只读）
 */
public interface PluginCatalogRepository {

    Optional<PluginPackage> findById(String pluginId);

    Optional<PluginPackage> findByNameAndVersion(String name, String version);

    /**
     * 名称模糊匹配（大小写不敏感的包含匹配）
     */
    List<PluginPackage> searchByName(String namePattern);

    List<PluginPackage> findByGameVersion(String gameVersion);

    List<PluginPackage> findAll();
}
