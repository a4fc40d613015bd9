package com.craftplane.core.plugin;

import com.craftplane.api.exception.InvalidArgumentException;
import com.craftplane.api.exception.PluginNotFoundException;
import com.craftplane.api.model.PluginPackage;
import com.craftplane.api.model.ServerPluginInstallation;
import com.craftplane.core.compat.CompatibilityResult;
import com.craftplane.core.compat.CompatibilityValidator;
import com.craftplane.core.compat.ResourceConflictRule;
import com.craftplane.core.config.CraftPlaneConfig;
import com.craftplane.core.conflict.ConflictAnalysis;
import com.craftplane.core.conflict.ConflictDetector;
import com.craftplane.core.conflict.ConflictRule;
import com.craftplane.core.graph.DependencyGraph;
import com.craftplane.core.graph.DependencyGraphBuilder;
import com.craftplane.core.graph.InstallOrderPlanner;
import com.craftplane.core.install.BulkInstallItem;
import com.craftplane.core.install.BulkInstallResult;
import com.craftplane.core.install.BulkUninstallResult;
import com.craftplane.core.install.ConfigureResult;
import com.craftplane.core.install.InstallRequest;
import com.craftplane.core.install.InstallResult;
import com.craftplane.core.install.InstallationOrchestrator;
import com.craftplane.core.install.PluginStatusResult;
import com.craftplane.core.install.UninstallOptions;
import com.craftplane.core.install.UpdateResult;
import com.craftplane.core.install.stream.InstallSubscription;
import com.craftplane.core.install.stream.InstallUpdateRegistry;
import com.craftplane.core.query.PluginFilters;
import com.craftplane.core.query.PluginQueryService;
import com.craftplane.core.query.PluginSearchQuery;
import com.craftplane.core.query.PluginSearchResult;
import com.craftplane.core.query.ServerPluginView;
import com.craftplane.core.spi.AuditSink;
import com.craftplane.core.spi.ComputeBackend;
import com.craftplane.core.spi.InstallationExecutor;
import com.craftplane.core.spi.InstallationRepository;
import com.craftplane.core.spi.PluginCatalogRepository;
import com.craftplane.core.spi.ServerRepository;
import com.craftplane.core.version.LexicographicVersionComparator;
import com.craftplane.core.version.VersionComparator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 插件管理入口
 * 职责：
 * 1. 组装校验、依赖解析、冲突检测、安装编排、查询等组件
 * 2. 对外暴露唯一的操作契约，前端 API / CLI 只依赖本类
 * 3. 停机时统一释放执行器与订阅
 */
@Slf4j
public class PluginManager {

    private final PluginCatalogRepository catalog;
    private final InstallationRepository installations;

    @Getter
    private final CompatibilityValidator validator;
    private final DependencyGraphBuilder graphBuilder;
    private final InstallOrderPlanner planner;
    private final ConflictDetector conflictDetector;
    private final InstallationOrchestrator orchestrator;
    private final PluginQueryService queryService;

    @Getter
    private final InstallUpdateRegistry updateRegistry;

    public PluginManager(CraftPlaneConfig config,
                         PluginCatalogRepository catalog,
                         InstallationRepository installations,
                         ServerRepository servers,
                         ComputeBackend computeBackend,
                         AuditSink auditSink,
                         InstallationExecutor executor) {
        this(config, catalog, installations, servers, computeBackend, auditSink, executor,
                new InstallUpdateRegistry(config.getSubscriberBufferSize()),
                new LexicographicVersionComparator(), null, null);
    }

    public PluginManager(CraftPlaneConfig config,
                         PluginCatalogRepository catalog,
                         InstallationRepository installations,
                         ServerRepository servers,
                         ComputeBackend computeBackend,
                         AuditSink auditSink,
                         InstallationExecutor executor,
                         InstallUpdateRegistry updateRegistry,
                         VersionComparator versionComparator,
                         List<ResourceConflictRule> resourceRules,
                         List<ConflictRule> conflictRules) {
        this.catalog = catalog;
        this.installations = installations;
        this.updateRegistry = updateRegistry;
        this.validator = new CompatibilityValidator(catalog, installations, servers, versionComparator,
                resourceRules != null ? resourceRules : CompatibilityValidator.defaultRules(), config);
        this.graphBuilder = new DependencyGraphBuilder(catalog, versionComparator);
        this.planner = new InstallOrderPlanner();
        this.conflictDetector = new ConflictDetector(
                conflictRules != null ? conflictRules : ConflictDetector.defaultRules(versionComparator));
        this.orchestrator = new InstallationOrchestrator(catalog, installations, servers, validator, graphBuilder,
                planner, computeBackend, auditSink, executor, updateRegistry, versionComparator, config);
        this.queryService = new PluginQueryService(catalog, installations, servers, config);
        log.info("PluginManager initialized (allowUnapproved={}, strictDependencies={})",
                config.isAllowUnapproved(), config.isStrictDependencies());
    }

    // ==================== 生命周期操作 ====================

    public InstallResult install(InstallRequest request) {
        return orchestrator.install(request);
    }

    public String uninstall(String serverId, String pluginId, UninstallOptions options) {
        return orchestrator.uninstall(serverId, pluginId, options);
    }

    public UpdateResult update(String serverId, String pluginId, String newVersion) {
        return orchestrator.update(serverId, pluginId, newVersion);
    }

    public ConfigureResult configure(String serverId, String pluginId, Map<String, Object> config) {
        return orchestrator.configure(serverId, pluginId, config);
    }

    public Map<String, Object> getConfig(String serverId, String pluginId) {
        return orchestrator.getConfig(serverId, pluginId);
    }

    public BulkInstallResult bulkInstall(String serverId, List<BulkInstallItem> items) {
        return orchestrator.bulkInstall(serverId, items);
    }

    public BulkUninstallResult bulkUninstall(String serverId, List<String> pluginIds, UninstallOptions options) {
        return orchestrator.bulkUninstall(serverId, pluginIds, options);
    }

    // ==================== 查询方法 ====================

    public PluginSearchResult search(PluginSearchQuery query) {
        return queryService.search(query);
    }

    public List<PluginPackage> getCompatiblePlugins(String gameVersion, String serverId) {
        return queryService.getCompatiblePlugins(gameVersion, serverId);
    }

    public List<ServerPluginView> listServerPlugins(String serverId, PluginFilters filters) {
        return queryService.listServerPlugins(serverId, filters);
    }

    public PluginStatusResult getStatus(String serverId, String pluginId) {
        return orchestrator.getStatus(serverId, pluginId);
    }

    public InstallSubscription subscribe(String installationId) {
        return orchestrator.subscribe(installationId);
    }

    // ==================== 分析方法 ====================

    public CompatibilityResult validateCompatibility(String pluginId, String serverId) {
        return validator.validate(pluginId, serverId);
    }

    public DependencyGraph resolveDependencies(List<String> pluginIds, String gameVersion) {
        return graphBuilder.resolve(pluginIds, gameVersion);
    }

    public List<String> getInstallOrder(DependencyGraph graph) {
        if (graph == null) {
            throw new InvalidArgumentException("graph", "Dependency graph cannot be null");
        }
        return planner.plan(graph);
    }

    public List<String> getInstallOrder(List<String> pluginIds, String gameVersion) {
        return planner.plan(graphBuilder.resolve(pluginIds, gameVersion));
    }

    /**
     * 候选插件与服务器已安装插件、以及候选之间的冲突
     */
    public ConflictAnalysis checkConflicts(String serverId, List<String> candidateIds) {
        if (serverId == null || serverId.isBlank()) {
            throw new InvalidArgumentException("serverId", "Server id cannot be blank");
        }
        if (candidateIds == null) {
            throw new InvalidArgumentException("candidateIds", "Candidate ids cannot be null");
        }
        List<PluginPackage> candidates = new ArrayList<>();
        for (String id : candidateIds) {
            candidates.add(catalog.findById(id).orElseThrow(() -> new PluginNotFoundException(id)));
        }

        List<PluginPackage> installed = new ArrayList<>();
        for (ServerPluginInstallation installation : installations.findByServer(serverId)) {
            if (!installation.isActive()) {
                continue;
            }
            Optional<PluginPackage> plugin = catalog.findById(installation.getPluginId());
            if (plugin.isPresent()) {
                installed.add(plugin.get());
            } else {
                log.warn("[{}] Installed plugin {} is missing from catalog, skipped", serverId,
                        installation.getPluginId());
            }
        }
        return conflictDetector.analyze(installed, candidates);
    }

    /**
     * 全局关闭
     */
    public void shutdown() {
        log.info("Shutting down PluginManager...");
        orchestrator.shutdown();
        log.info("PluginManager shutdown complete.");
    }
}
