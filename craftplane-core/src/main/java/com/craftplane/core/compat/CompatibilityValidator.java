package com.craftplane.core.compat;

import com.craftplane.api.exception.InvalidArgumentException;
import com.craftplane.api.exception.PluginNotFoundException;
import com.craftplane.api.exception.ReasonCode;
import com.craftplane.api.exception.ServerNotFoundException;
import com.craftplane.api.model.InstallationStatus;
import com.craftplane.api.model.PluginPackage;
import com.craftplane.api.model.ServerInstance;
import com.craftplane.api.model.ServerPluginInstallation;
import com.craftplane.core.config.CraftPlaneConfig;
import com.craftplane.core.spi.InstallationRepository;
import com.craftplane.core.spi.PluginCatalogRepository;
import com.craftplane.core.spi.ServerRepository;
import com.craftplane.core.version.VersionComparator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 兼容性校验器
 * <p>
 * 判断插件能否安装到指定服务器，检查顺序：
 * <ol>
 *   <li>游戏版本</li>
 *   <li>审核状态</li>
 *   <li>直接依赖</li>
 *   <li>资源冲突</li>
 * </ol>
 * 所有检查都会执行，结果中的 reason 取第一个阻断项。
 */
@Slf4j
public class CompatibilityValidator {

    // 依赖检查时视为"已在服务器上"的状态
    private static final Set<InstallationStatus> PRESENT_STATUSES =
            EnumSet.of(InstallationStatus.PENDING, InstallationStatus.INSTALLING, InstallationStatus.INSTALLED);

    private final PluginCatalogRepository catalog;
    private final InstallationRepository installations;
    private final ServerRepository servers;
    private final VersionComparator versionComparator;
    private final List<ResourceConflictRule> conflictRules;
    private final CraftPlaneConfig config;

    public CompatibilityValidator(PluginCatalogRepository catalog,
                                  InstallationRepository installations,
                                  ServerRepository servers,
                                  VersionComparator versionComparator,
                                  List<ResourceConflictRule> conflictRules,
                                  CraftPlaneConfig config) {
        this.catalog = catalog;
        this.installations = installations;
        this.servers = servers;
        this.versionComparator = versionComparator;
        this.conflictRules = List.copyOf(conflictRules);
        this.config = config;
    }

    public static List<ResourceConflictRule> defaultRules() {
        return List.of(new DuplicatePackageRule(), new CommandOverlapRule());
    }

    // ==================== 校验入口 ====================

    public CompatibilityResult validate(String pluginId, String serverId) {
        if (pluginId == null || pluginId.isBlank()) {
            throw new InvalidArgumentException("pluginId", "Plugin id cannot be blank");
        }
        if (serverId == null || serverId.isBlank()) {
            throw new InvalidArgumentException("serverId", "Server id cannot be blank");
        }
        PluginPackage plugin = catalog.findById(pluginId)
                .orElseThrow(() -> new PluginNotFoundException(pluginId));
        ServerInstance server = servers.findById(serverId)
                .orElseThrow(() -> new ServerNotFoundException(serverId));
        return validate(plugin, server, Set.of());
    }

    /**
     * @param plannedDependencies 已计划随本次安装一起安装的依赖名，不报缺失
     */
    public CompatibilityResult validate(PluginPackage plugin, ServerInstance server,
                                        Collection<String> plannedDependencies) {
        List<PluginPackage> present = loadPresentPlugins(server.getId(), plugin.getId());

        CompatibilityResult.CompatibilityResultBuilder builder = CompatibilityResult.builder();
        String reason = null;
        ReasonCode reasonCode = null;

        // 1. 游戏版本
        boolean gameVersionCompatible = plugin.isCompatibleWith(server.getGameVersion());
        builder.gameVersionCompatible(gameVersionCompatible);
        if (!gameVersionCompatible) {
            reason = String.format("Plugin %s does not support game version %s (supported: %s)",
                    plugin.getUniqueKey(), server.getGameVersion(), plugin.getGameVersions());
            reasonCode = ReasonCode.VERSION_MISMATCH;
        }

        // 2. 审核
        boolean approvalBlocked = !plugin.isApproved() && !config.isAllowUnapproved();
        if (approvalBlocked && reasonCode == null) {
            reason = String.format("Plugin %s is not approved", plugin.getUniqueKey());
            reasonCode = ReasonCode.UNAPPROVED;
        }

        // 3. 直接依赖
        List<DependencyIssue> issues = checkDependencies(plugin, present, plannedDependencies);
        builder.dependencyIssues(issues);
        if (!issues.isEmpty() && reasonCode == null) {
            DependencyIssue first = issues.get(0);
            reason = first.message();
            reasonCode = first.type() == DependencyIssueType.MISSING
                    ? ReasonCode.DEPENDENCY_MISSING : ReasonCode.VERSION_MISMATCH;
        }

        // 4. 资源冲突
        List<ResourceConflict> conflicts = new ArrayList<>();
        for (ResourceConflictRule rule : conflictRules) {
            conflicts.addAll(rule.check(plugin, present));
        }
        builder.resourceConflicts(conflicts);
        if (!conflicts.isEmpty() && reasonCode == null) {
            reason = conflicts.get(0).description();
            reasonCode = ReasonCode.RESOURCE_CONFLICT;
        }

        boolean compatible = gameVersionCompatible && !approvalBlocked && issues.isEmpty() && conflicts.isEmpty();
        if (!compatible) {
            log.debug("[{}] Plugin {} is incompatible: {}", server.getId(), plugin.getUniqueKey(), reason);
        }
        return builder.compatible(compatible)
                .reason(reason)
                .reasonCode(reasonCode)
                .build();
    }

    /**
     * 每个直接依赖在服务器上的满足情况，按依赖声明顺序
     */
    public Map<String, DependencyStatus> dependencyStatus(PluginPackage plugin, String serverId) {
        List<PluginPackage> present = loadPresentPlugins(serverId, plugin.getId());
        Map<String, DependencyStatus> result = new LinkedHashMap<>();
        plugin.getDependencies().forEach((name, constraint) -> {
            Optional<DependencyIssue> issue = checkDependency(name, constraint, present);
            if (issue.isEmpty()) {
                result.put(name, DependencyStatus.SATISFIED);
            } else if (issue.get().type() == DependencyIssueType.MISSING) {
                result.put(name, DependencyStatus.MISSING);
            } else {
                result.put(name, DependencyStatus.OUTDATED);
            }
        });
        return result;
    }

    // ==================== 内部方法 ====================

    private List<DependencyIssue> checkDependencies(PluginPackage plugin, List<PluginPackage> present,
                                                    Collection<String> planned) {
        List<DependencyIssue> issues = new ArrayList<>();
        plugin.getDependencies().forEach((name, constraint) -> {
            Optional<DependencyIssue> issue = checkDependency(name, constraint, present);
            if (issue.isEmpty()) {
                return;
            }
            if (issue.get().type() == DependencyIssueType.MISSING && planned.contains(name)) {
                return;
            }
            issues.add(issue.get());
        });
        return issues;
    }

    private Optional<DependencyIssue> checkDependency(String name, String constraint, List<PluginPackage> present) {
        String foundVersion = null;
        for (PluginPackage p : present) {
            if (!p.getName().equals(name)) {
                continue;
            }
            if (versionComparator.satisfies(p.getVersion(), constraint)) {
                return Optional.empty();
            }
            foundVersion = p.getVersion();
        }
        if (foundVersion == null) {
            return Optional.of(DependencyIssue.missing(name, constraint));
        }
        return Optional.of(DependencyIssue.versionMismatch(name, constraint, foundVersion));
    }

    /**
     * 服务器上处于 pending/installing/installed 的插件，排除 excludePluginId
     */
    private List<PluginPackage> loadPresentPlugins(String serverId, String excludePluginId) {
        List<PluginPackage> present = new ArrayList<>();
        for (ServerPluginInstallation installation : installations.findByServer(serverId)) {
            if (!PRESENT_STATUSES.contains(installation.getStatus())
                    || installation.getPluginId().equals(excludePluginId)) {
                continue;
            }
            Optional<PluginPackage> plugin = catalog.findById(installation.getPluginId());
            if (plugin.isPresent()) {
                present.add(plugin.get());
            } else {
                log.warn("[{}] Installed plugin {} is missing from catalog, skipped", serverId,
                        installation.getPluginId());
            }
        }
        return present;
    }
}
