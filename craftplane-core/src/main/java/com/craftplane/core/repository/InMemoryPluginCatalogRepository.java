package com.craftplane.core.repository;

import com.craftplane.api.model.PluginPackage;
import com.craftplane.core.spi.PluginCatalogRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存插件目录
 * <p>
 * 写入前校验条目，按注册顺序返回结果。
 */
@Slf4j
public class InMemoryPluginCatalogRepository implements PluginCatalogRepository {

    private final Map<String, PluginPackage> plugins = new ConcurrentHashMap<>();
    // 保持注册顺序，保证查询结果稳定
    private final List<String> order = new ArrayList<>();

    public InMemoryPluginCatalogRepository() {
    }

    public InMemoryPluginCatalogRepository(Collection<PluginPackage> initial) {
        initial.forEach(this::register);
    }

    public synchronized void register(PluginPackage plugin) {
        plugin.validate();
        if (plugin.getId() == null || plugin.getId().isBlank()) {
            throw new IllegalArgumentException("Plugin id cannot be blank: " + plugin.getUniqueKey());
        }
        if (plugins.put(plugin.getId(), plugin) == null) {
            order.add(plugin.getId());
        }
        log.debug("Catalog entry registered: {} ({})", plugin.getId(), plugin.getUniqueKey());
    }

    public synchronized void remove(String pluginId) {
        if (plugins.remove(pluginId) != null) {
            order.remove(pluginId);
        }
    }

    @Override
    public Optional<PluginPackage> findById(String pluginId) {
        if (pluginId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(plugins.get(pluginId));
    }

    @Override
    public Optional<PluginPackage> findByNameAndVersion(String name, String version) {
        return snapshot().stream()
                .filter(p -> p.getName().equals(name) && p.getVersion().equals(version))
                .findFirst();
    }

    @Override
    public List<PluginPackage> searchByName(String namePattern) {
        String needle = namePattern == null ? "" : namePattern.toLowerCase(Locale.ROOT);
        return snapshot().stream()
                .filter(p -> p.getName().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    @Override
    public List<PluginPackage> findByGameVersion(String gameVersion) {
        return snapshot().stream()
                .filter(p -> p.isCompatibleWith(gameVersion))
                .toList();
    }

    @Override
    public List<PluginPackage> findAll() {
        return snapshot();
    }

    public int size() {
        return plugins.size();
    }

    private synchronized List<PluginPackage> snapshot() {
        List<PluginPackage> result = new ArrayList<>(order.size());
        for (String id : order) {
            result.add(plugins.get(id));
        }
        return result;
    }
}
