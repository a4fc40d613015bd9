package com.craftplane.core.query;

import com.craftplane.api.exception.InvalidArgumentException;
import com.craftplane.api.exception.ServerNotFoundException;
import com.craftplane.api.model.PluginPackage;
import com.craftplane.api.model.ServerPluginInstallation;
import com.craftplane.core.config.CraftPlaneConfig;
import com.craftplane.core.spi.InstallationRepository;
import com.craftplane.core.spi.PluginCatalogRepository;
import com.craftplane.core.spi.ServerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 目录查询与服务器插件列表
 */
@Slf4j
@RequiredArgsConstructor
public class PluginQueryService {

    private final PluginCatalogRepository catalog;
    private final InstallationRepository installations;
    private final ServerRepository servers;
    private final CraftPlaneConfig config;

    // ==================== 目录搜索 ====================

    public PluginSearchResult search(PluginSearchQuery query) {
        PluginSearchQuery q = query != null ? query : PluginSearchQuery.all();
        if (q.getOffset() < 0) {
            throw new InvalidArgumentException("offset", "Offset cannot be negative: " + q.getOffset());
        }
        if (q.getLimit() != null && q.getLimit() < 0) {
            throw new InvalidArgumentException("limit", "Limit cannot be negative: " + q.getLimit());
        }
        int pageSize = q.getLimit() == null || q.getLimit() == 0
                ? config.getDefaultPageSize()
                : Math.min(q.getLimit(), config.getMaxPageSize());

        // 先按最有选择性的条件取基础集合，其余条件在内存中过滤
        List<PluginPackage> base;
        if (q.getText() != null && !q.getText().isBlank()) {
            base = catalog.searchByName(q.getText().trim());
        } else if (q.getGameVersion() != null && !q.getGameVersion().isBlank()) {
            base = catalog.findByGameVersion(q.getGameVersion());
        } else {
            base = catalog.findAll();
        }

        Stream<PluginPackage> stream = base.stream();
        if (q.getText() != null && !q.getText().isBlank()) {
            String needle = q.getText().trim().toLowerCase(Locale.ROOT);
            stream = stream.filter(p -> p.getName().toLowerCase(Locale.ROOT).contains(needle));
        }
        if (q.getCategory() != null) {
            stream = stream.filter(p -> p.getCategory() == q.getCategory());
        }
        if (q.getGameVersion() != null && !q.getGameVersion().isBlank()) {
            stream = stream.filter(p -> p.isCompatibleWith(q.getGameVersion()));
        }
        if (q.isApprovedOnly()) {
            stream = stream.filter(PluginPackage::isApproved);
        }

        Comparator<PluginPackage> order = q.getSortBy().comparator();
        if (q.getSortOrder() == SortOrder.DESC) {
            order = order.reversed();
        }
        order = order.thenComparing(PluginPackage::getName).thenComparing(PluginPackage::getId);

        List<PluginPackage> matched = stream.sorted(order).toList();
        int total = matched.size();
        List<PluginPackage> page = q.getOffset() >= total
                ? List.of()
                : matched.subList(q.getOffset(), Math.min(total, q.getOffset() + pageSize));
        int totalPages = (total + pageSize - 1) / pageSize;

        log.debug("Plugin search {} matched {} entries", q, total);
        return new PluginSearchResult(page, total, q.getOffset() / pageSize + 1, pageSize, totalPages);
    }

    /**
     * 支持指定游戏版本、且尚未安装到 serverId 上的插件
     *
     * @param serverId 可为 null，此时不排除任何插件
     */
    public List<PluginPackage> getCompatiblePlugins(String gameVersion, String serverId) {
        if (gameVersion == null || gameVersion.isBlank()) {
            throw new InvalidArgumentException("gameVersion", "Game version cannot be blank");
        }
        Set<String> installed = Set.of();
        if (serverId != null && !serverId.isBlank()) {
            installed = installations.findByServer(serverId).stream()
                    .filter(ServerPluginInstallation::isActive)
                    .map(ServerPluginInstallation::getPluginId)
                    .collect(Collectors.toSet());
        }
        Set<String> exclude = installed;
        return catalog.findByGameVersion(gameVersion).stream()
                .filter(p -> p.isApproved() || config.isAllowUnapproved())
                .filter(p -> !exclude.contains(p.getId()))
                .toList();
    }

    // ==================== 服务器插件列表 ====================

    public List<ServerPluginView> listServerPlugins(String serverId, PluginFilters filters) {
        if (serverId == null || serverId.isBlank()) {
            throw new InvalidArgumentException("serverId", "Server id cannot be blank");
        }
        if (servers.findById(serverId).isEmpty()) {
            throw new ServerNotFoundException(serverId);
        }
        PluginFilters f = filters != null ? filters : PluginFilters.none();

        List<ServerPluginView> result = new ArrayList<>();
        for (ServerPluginInstallation installation : installations.findByServer(serverId, f.getStatus())) {
            PluginPackage plugin = catalog.findById(installation.getPluginId()).orElse(null);
            if (plugin == null) {
                log.warn("[{}] Installed plugin {} is missing from catalog", serverId, installation.getPluginId());
            }
            ServerPluginView view = new ServerPluginView(installation, plugin);
            if (f.getEnabled() != null && view.isEnabled() != f.getEnabled()) {
                continue;
            }
            if (f.getCategory() != null && (plugin == null || plugin.getCategory() != f.getCategory())) {
                continue;
            }
            result.add(view);
        }
        return result;
    }
}
