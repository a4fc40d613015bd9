package com.craftplane.core.graph;

import com.craftplane.api.exception.InvalidArgumentException;
import com.craftplane.api.exception.PluginNotFoundException;
import com.craftplane.api.model.PluginPackage;
import com.craftplane.core.spi.PluginCatalogRepository;
import com.craftplane.core.version.VersionComparator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 依赖图构建器
 * <p>
 * 从请求的插件出发深度优先遍历目录，按依赖名选择具体版本：
 * 优先支持目标游戏版本的，其次满足版本约束的，最后取最高版本。
 * 目录中找不到的依赖名跳过，由兼容性校验报告缺失。
 */
@Slf4j
@RequiredArgsConstructor
public class DependencyGraphBuilder {

    private final PluginCatalogRepository catalog;
    private final VersionComparator versionComparator;

    public DependencyGraph resolve(List<String> pluginIds, String gameVersion) {
        if (pluginIds == null) {
            throw new InvalidArgumentException("pluginIds", "Plugin ids cannot be null");
        }
        DependencyGraph graph = new DependencyGraph();
        Set<String> visited = new HashSet<>();
        for (String pluginId : pluginIds) {
            PluginPackage plugin = catalog.findById(pluginId)
                    .orElseThrow(() -> new PluginNotFoundException(pluginId));
            visit(plugin, gameVersion, graph, visited);
        }
        log.debug("Dependency graph resolved for {}: {}", pluginIds, graph);
        return graph;
    }

    private void visit(PluginPackage plugin, String gameVersion, DependencyGraph graph, Set<String> visited) {
        if (!visited.add(plugin.getId())) {
            return;
        }
        graph.addNode(new DependencyNode(plugin.getId(), plugin.getName(), plugin.getVersion(), true));

        for (Map.Entry<String, String> dep : plugin.getDependencies().entrySet()) {
            Optional<PluginPackage> resolved = selectCandidate(dep.getKey(), dep.getValue(), gameVersion);
            if (resolved.isEmpty()) {
                log.debug("Dependency {} of {} not found in catalog, skipped", dep.getKey(), plugin.getUniqueKey());
                continue;
            }
            PluginPackage target = resolved.get();
            visit(target, gameVersion, graph, visited);
            graph.addEdge(new DependencyEdge(plugin.getId(), target.getId(), dep.getValue(), false));
        }
    }

    private Optional<PluginPackage> selectCandidate(String name, String constraint, String gameVersion) {
        // searchByName 是包含匹配，这里再做精确过滤
        List<PluginPackage> candidates = catalog.searchByName(name).stream()
                .filter(p -> p.getName().equals(name))
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Comparator<PluginPackage> preference = Comparator
                .comparing((PluginPackage p) -> p.isCompatibleWith(gameVersion))
                .thenComparing(p -> versionComparator.satisfies(p.getVersion(), constraint))
                .thenComparing(PluginPackage::getVersion, versionComparator::compare);
        return candidates.stream().max(preference);
    }
}
