package com.craftplane.core.install;

import com.craftplane.api.exception.CraftPlaneException;
import com.craftplane.api.exception.DependencyInstallException;
import com.craftplane.api.exception.InstallationConflictException;
import com.craftplane.api.exception.InstallationNotFoundException;
import com.craftplane.api.exception.InvalidArgumentException;
import com.craftplane.api.exception.PluginNotFoundException;
import com.craftplane.api.exception.ReasonCode;
import com.craftplane.api.exception.ServerNotFoundException;
import com.craftplane.api.model.InstallationStatus;
import com.craftplane.api.model.PluginPackage;
import com.craftplane.api.model.ServerInstance;
import com.craftplane.api.model.ServerPluginInstallation;
import com.craftplane.core.audit.AuditAction;
import com.craftplane.core.audit.AuditEvent;
import com.craftplane.core.compat.CompatibilityResult;
import com.craftplane.core.compat.CompatibilityValidator;
import com.craftplane.core.compat.DependencyStatus;
import com.craftplane.core.config.CraftPlaneConfig;
import com.craftplane.core.exception.IncompatiblePluginException;
import com.craftplane.core.graph.DependencyGraph;
import com.craftplane.core.graph.DependencyGraphBuilder;
import com.craftplane.core.graph.InstallOrderPlanner;
import com.craftplane.core.install.stream.InstallSubscription;
import com.craftplane.core.install.stream.InstallUpdate;
import com.craftplane.core.install.stream.InstallUpdateRegistry;
import com.craftplane.core.spi.AuditSink;
import com.craftplane.core.spi.ComputeBackend;
import com.craftplane.core.spi.InstallationExecutor;
import com.craftplane.core.spi.InstallationRepository;
import com.craftplane.core.spi.PluginCatalogRepository;
import com.craftplane.core.spi.ServerRepository;
import com.craftplane.core.version.VersionComparator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 安装编排器
 * <p>
 * 职责：
 * 1. 安装/卸载/更新/配置的同步校验与记录创建
 * 2. 把真正的变更交给 {@link InstallationExecutor} 异步执行
 * 3. 通过 {@link InstallUpdateRegistry} 推送进度
 * <p>
 * 同一服务器的"检查并创建"由服务器级锁串行化，同一插件的并发重复安装只有一个成功。
 * 异步阶段的失败不会抛给调用方，统一落为 FAILED 记录 + 错误信息 + 最终进度消息。
 */
@Slf4j
public class InstallationOrchestrator {

    private static final String MAJOR_VERSION_CHANGE = "Major version change - potential breaking changes";

    private final PluginCatalogRepository catalog;
    private final InstallationRepository installations;
    private final ServerRepository servers;
    private final CompatibilityValidator validator;
    private final DependencyGraphBuilder graphBuilder;
    private final InstallOrderPlanner planner;
    private final ComputeBackend computeBackend;
    private final AuditSink auditSink;
    private final InstallationExecutor executor;
    private final InstallUpdateRegistry updateRegistry;
    private final VersionComparator versionComparator;
    private final ConfigOverridesValidator configValidator;
    private final CraftPlaneConfig config;

    // 服务器级锁：Key=ServerId，只为已登记的服务器创建，条目数不超过服务器总数
    private final Map<String, ReentrantLock> serverLocks = new ConcurrentHashMap<>();

    public InstallationOrchestrator(PluginCatalogRepository catalog,
                                    InstallationRepository installations,
                                    ServerRepository servers,
                                    CompatibilityValidator validator,
                                    DependencyGraphBuilder graphBuilder,
                                    InstallOrderPlanner planner,
                                    ComputeBackend computeBackend,
                                    AuditSink auditSink,
                                    InstallationExecutor executor,
                                    InstallUpdateRegistry updateRegistry,
                                    VersionComparator versionComparator,
                                    CraftPlaneConfig config) {
        this.catalog = catalog;
        this.installations = installations;
        this.servers = servers;
        this.validator = validator;
        this.graphBuilder = graphBuilder;
        this.planner = planner;
        this.computeBackend = computeBackend;
        this.auditSink = auditSink;
        this.executor = executor;
        this.updateRegistry = updateRegistry;
        this.versionComparator = versionComparator;
        this.configValidator = new ConfigOverridesValidator(config);
        this.config = config;
    }

    // ==================== 安装 ====================

    public InstallResult install(InstallRequest request) {
        if (request == null) {
            throw new InvalidArgumentException("request", "Install request cannot be null");
        }
        String serverId = requireId("serverId", request.getServerId());
        String pluginId = requireId("pluginId", request.getPluginId());

        ServerInstance server = loadServer(serverId);
        PluginPackage plugin = loadPlugin(pluginId);

        ReentrantLock lock = lockFor(serverId);
        lock.lock();
        try {
            // 1. 重复安装检查
            installations.findByServerAndPlugin(serverId, pluginId).ifPresent(existing -> {
                if (existing.isInstalled()) {
                    throw new InstallationConflictException(ReasonCode.ALREADY_INSTALLED, serverId, pluginId,
                            String.format("Plugin %s is already installed on server %s", pluginId, serverId));
                }
                if (existing.isInProgress()) {
                    throw new InstallationConflictException(ReasonCode.INSTALL_IN_PROGRESS, serverId, pluginId,
                            String.format("Plugin %s has an operation in progress on server %s (%s)",
                                    pluginId, serverId, existing.getStatus().code()));
                }
                if (existing.isFailed()) {
                    log.info("[{}] Removing failed installation record {} before retry", serverId, existing.getId());
                    installations.delete(existing.getId());
                }
            });

            // 2. 配置覆盖项
            configValidator.validate(request.getConfigOverrides());

            // 3. 依赖规划
            List<String> dependencyIds = List.of();
            Set<String> plannedNames = Set.of();
            if (request.isAutoDependencies()) {
                DependencyGraph graph = graphBuilder.resolve(List.of(pluginId), server.getGameVersion());
                List<String> order = planner.plan(graph);
                plannedNames = new HashSet<>();
                List<String> toInstall = new ArrayList<>();
                Set<String> presentNames = activePluginNames(serverId);
                for (String id : order) {
                    if (id.equals(pluginId)) {
                        continue;
                    }
                    String name = graph.getNode(id).name();
                    plannedNames.add(name);
                    if (!presentNames.contains(name)) {
                        toInstall.add(id);
                    }
                }
                dependencyIds = toInstall;
                log.debug("[{}] Install order for {}: {} (to install: {})", serverId, pluginId, order, toInstall);
            }

            // 4. 兼容性
            CompatibilityResult compatibility = validator.validate(plugin, server, plannedNames);
            if (!compatibility.isCompatible()) {
                if (!request.isForce()) {
                    throw new IncompatiblePluginException(pluginId, serverId, compatibility);
                }
                log.warn("[{}] Forcing installation of incompatible plugin {}: {}",
                        serverId, plugin.getUniqueKey(), compatibility.getReason());
            }

            // 5. 依赖安装
            List<String> requested = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            for (String dependencyId : dependencyIds) {
                try {
                    install(InstallRequest.builder()
                            .serverId(serverId)
                            .pluginId(dependencyId)
                            .force(request.isForce())
                            .build());
                    requested.add(dependencyId);
                } catch (CraftPlaneException e) {
                    if (config.isStrictDependencies()) {
                        log.warn("[{}] Dependency {} of {} failed, aborting: {}",
                                serverId, dependencyId, pluginId, e.getMessage());
                        throw new DependencyInstallException(pluginId, dependencyId, e);
                    }
                    log.warn("[{}] Failed to install dependency {} of {}: {}",
                            serverId, dependencyId, pluginId, e.getMessage());
                    failed.add(dependencyId);
                }
            }

            // 6. 创建记录并提交
            ServerPluginInstallation record = new ServerPluginInstallation(
                    UUID.randomUUID().toString(), serverId, pluginId, InstallationStatus.PENDING);
            record.setConfigOverrides(request.getConfigOverrides());
            record.appendToLog("Installation requested for " + plugin.getUniqueKey());
            installations.create(record);
            log.info("[{}] Installing plugin {} (installation {})", serverId, plugin.getUniqueKey(), record.getId());

            boolean accepted = submit(record.getId(), serverId, () -> runInstall(record.getId(), server, plugin));

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("installationId", record.getId());
            details.put("version", plugin.getVersion());
            details.put("dependencies", requested);
            details.put("force", request.isForce());
            auditSink.record(AuditEvent.of(AuditAction.PLUGIN_INSTALLED, serverId, pluginId, details));

            return InstallResult.builder()
                    .installationId(record.getId())
                    .pluginId(pluginId)
                    .status(accepted ? InstallationStatus.PENDING : InstallationStatus.FAILED)
                    .estimatedDuration(estimateInstall(plugin))
                    .dependencies(requested)
                    .failedDependencies(failed)
                    .requiresRestart(requiresRestart(plugin))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 预计耗时：基础时长 + 每个直接依赖的附加时长
     */
    public Duration estimateInstall(PluginPackage plugin) {
        return config.getBaseInstallEstimate()
                .plus(config.getPerDependencyEstimate().multipliedBy(plugin.getDependencies().size()));
    }

    private void runInstall(String installationId, ServerInstance server, PluginPackage plugin) {
        try {
            ServerPluginInstallation record = loadRecord(installationId);
            record.transitionTo(InstallationStatus.INSTALLING);
            saveProgress(record, 10, "Starting installation");

            saveProgress(record, 50, "Downloading plugin");
            computeBackend.stagePlugin(server, plugin);

            saveProgress(record, 80, "Installing plugin");
            computeBackend.installPlugin(server, plugin);

            record.transitionTo(InstallationStatus.INSTALLED);
            record.appendToLog("Installation completed");
            installations.update(record);
            updateRegistry.publish(InstallUpdate.of(installationId, InstallationStatus.INSTALLED, 100,
                    "Installation completed"));
            log.info("[{}] Plugin {} installed", server.getId(), plugin.getUniqueKey());
        } catch (Exception e) {
            fail(installationId, server.getId(), "Installation failed", e);
        }
    }

    // ==================== 卸载 ====================

    /**
     * @return 安装记录 id，可用于订阅卸载进度
     */
    public String uninstall(String serverId, String pluginId, UninstallOptions options) {
        requireId("serverId", serverId);
        requireId("pluginId", pluginId);
        UninstallOptions opts = options != null ? options : UninstallOptions.defaults();

        ServerInstance server = loadServer(serverId);

        ReentrantLock lock = lockFor(serverId);
        lock.lock();
        try {
            ServerPluginInstallation record = requireInstalled(serverId, pluginId);
            PluginPackage plugin = loadPlugin(pluginId);

            if (!opts.isSkipDependencies()) {
                List<String> dependents = findDependents(serverId, plugin);
                if (!dependents.isEmpty()) {
                    if (!opts.isForce()) {
                        throw new InstallationConflictException(ReasonCode.DEPENDENCY_BLOCKED, serverId, pluginId,
                                dependents, String.format("Plugin %s is required by %s", plugin.getName(), dependents));
                    }
                    log.warn("[{}] Force removing {} although required by {}", serverId, plugin.getName(), dependents);
                }
            }

            record.transitionTo(InstallationStatus.REMOVING);
            record.appendToLog("Removal requested");
            installations.update(record);
            log.info("[{}] Uninstalling plugin {} (installation {})", serverId, plugin.getUniqueKey(), record.getId());

            submit(record.getId(), serverId, () -> runUninstall(record.getId(), server, plugin, opts));

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("installationId", record.getId());
            details.put("removeConfig", opts.isRemoveConfig());
            details.put("removeData", opts.isRemoveData());
            details.put("force", opts.isForce());
            auditSink.record(AuditEvent.of(AuditAction.PLUGIN_UNINSTALLED, serverId, pluginId, details));
            return record.getId();
        } finally {
            lock.unlock();
        }
    }

    private void runUninstall(String installationId, ServerInstance server, PluginPackage plugin,
                              UninstallOptions options) {
        try {
            ServerPluginInstallation record = loadRecord(installationId);
            saveProgress(record, 10, "Starting removal");

            computeBackend.removePlugin(server, plugin, options);

            installations.delete(installationId);
            updateRegistry.publish(InstallUpdate.of(installationId, InstallationStatus.REMOVED, 100,
                    "Plugin removed"));
            log.info("[{}] Plugin {} removed", server.getId(), plugin.getUniqueKey());
        } catch (Exception e) {
            fail(installationId, server.getId(), "Removal failed", e);
        }
    }

    // ==================== 更新 ====================

    public UpdateResult update(String serverId, String pluginId, String newVersion) {
        requireId("serverId", serverId);
        requireId("pluginId", pluginId);
        requireId("newVersion", newVersion);

        ServerInstance server = loadServer(serverId);

        ReentrantLock lock = lockFor(serverId);
        lock.lock();
        try {
            ServerPluginInstallation record = requireInstalled(serverId, pluginId);
            PluginPackage current = loadPlugin(pluginId);
            PluginPackage target = catalog.findByNameAndVersion(current.getName(), newVersion)
                    .orElseThrow(() -> PluginNotFoundException.version(current.getName(), newVersion));

            if (target.getVersion().equals(current.getVersion())) {
                throw new InstallationConflictException(ReasonCode.ALREADY_INSTALLED, serverId, pluginId,
                        String.format("Plugin %s is already at version %s", current.getName(), newVersion));
            }

            // 新版本可能留有旧的失败记录
            Optional<ServerPluginInstallation> stale = installations.findByServerAndPlugin(serverId, target.getId());
            if (stale.isPresent()) {
                if (!stale.get().isFailed()) {
                    throw new InstallationConflictException(ReasonCode.INSTALL_IN_PROGRESS, serverId, target.getId(),
                            String.format("Plugin %s already has a record on server %s", target.getId(), serverId));
                }
                installations.delete(stale.get().getId());
            }

            CompatibilityResult compatibility = validator.validate(target, server, Set.of());
            if (!compatibility.isCompatible()) {
                throw new IncompatiblePluginException(target.getId(), serverId, compatibility);
            }

            record.setPluginId(target.getId());
            record.transitionTo(InstallationStatus.INSTALLING);
            record.appendToLog(String.format("Update requested %s -> %s", current.getVersion(), target.getVersion()));
            installations.update(record);
            log.info("[{}] Updating plugin {} from {} to {}", serverId, current.getName(),
                    current.getVersion(), target.getVersion());

            boolean accepted = submit(record.getId(), serverId, () -> runUpdate(record.getId(), server, target));

            List<String> breakingChanges = versionComparator.isMajorChange(current.getVersion(), target.getVersion())
                    ? List.of(MAJOR_VERSION_CHANGE) : List.of();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("installationId", record.getId());
            details.put("fromVersion", current.getVersion());
            details.put("toVersion", target.getVersion());
            auditSink.record(AuditEvent.of(AuditAction.PLUGIN_UPDATED, serverId, pluginId, details));

            return UpdateResult.builder()
                    .installationId(record.getId())
                    .oldVersion(current.getVersion())
                    .newVersion(target.getVersion())
                    .status(accepted ? InstallationStatus.INSTALLING : InstallationStatus.FAILED)
                    .requiresRestart(requiresRestart(target))
                    .breakingChanges(breakingChanges)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private void runUpdate(String installationId, ServerInstance server, PluginPackage target) {
        try {
            ServerPluginInstallation record = loadRecord(installationId);
            saveProgress(record, 10, "Starting update");
            computeBackend.stagePlugin(server, target);

            saveProgress(record, 80, "Installing plugin");
            computeBackend.installPlugin(server, target);

            record.transitionTo(InstallationStatus.INSTALLED);
            record.appendToLog("Update completed");
            installations.update(record);
            updateRegistry.publish(InstallUpdate.of(installationId, InstallationStatus.INSTALLED, 100,
                    "Update completed"));
            log.info("[{}] Plugin {} updated", server.getId(), target.getUniqueKey());
        } catch (Exception e) {
            fail(installationId, server.getId(), "Update failed", e);
        }
    }

    // ==================== 配置 ====================

    public ConfigureResult configure(String serverId, String pluginId, Map<String, Object> overrides) {
        requireId("serverId", serverId);
        requireId("pluginId", pluginId);
        if (overrides == null) {
            throw new InvalidArgumentException(ReasonCode.INVALID_CONFIGURATION, "config", "Configuration cannot be null");
        }
        configValidator.validate(overrides);

        ServerInstance server = loadServer(serverId);
        ServerPluginInstallation record;
        PluginPackage plugin;

        ReentrantLock lock = lockFor(serverId);
        lock.lock();
        try {
            record = requireInstalled(serverId, pluginId);
            plugin = loadPlugin(pluginId);
            record.setConfigOverrides(overrides);
            record.appendToLog("Configuration updated (" + overrides.size() + " entries)");
            installations.update(record);
        } finally {
            lock.unlock();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("installationId", record.getId());
        details.put("keys", List.copyOf(overrides.keySet()));
        auditSink.record(AuditEvent.of(AuditAction.PLUGIN_CONFIGURED, serverId, pluginId, details));

        try {
            computeBackend.applyConfiguration(server, plugin, new HashMap<>(overrides));
            log.info("[{}] Configuration of {} applied", serverId, plugin.getUniqueKey());
            return new ConfigureResult(record.getId(), true, "Configuration applied");
        } catch (RuntimeException e) {
            // 配置已保存，只是没推送到运行实例
            log.warn("[{}] Configuration of {} saved but not applied: {}", serverId, plugin.getUniqueKey(),
                    e.getMessage(), e);
            return new ConfigureResult(record.getId(), false,
                    "Configuration saved but could not be applied: " + e.getMessage());
        }
    }

    public Map<String, Object> getConfig(String serverId, String pluginId) {
        requireId("serverId", serverId);
        requireId("pluginId", pluginId);
        ServerPluginInstallation record = installations.findByServerAndPlugin(serverId, pluginId)
                .orElseThrow(() -> new InstallationNotFoundException(serverId, pluginId));
        return new HashMap<>(record.getConfigOverrides());
    }

    // ==================== 状态与订阅 ====================

    public PluginStatusResult getStatus(String serverId, String pluginId) {
        requireId("serverId", serverId);
        requireId("pluginId", pluginId);
        ServerPluginInstallation record = installations.findByServerAndPlugin(serverId, pluginId)
                .orElseThrow(() -> new InstallationNotFoundException(serverId, pluginId));
        PluginPackage plugin = loadPlugin(pluginId);

        Map<String, DependencyStatus> dependencyStatus = validator.dependencyStatus(plugin, serverId);

        String latestVersion = catalog.searchByName(plugin.getName()).stream()
                .filter(p -> p.getName().equals(plugin.getName()))
                .map(PluginPackage::getVersion)
                .max(versionComparator::compare)
                .orElse(plugin.getVersion());

        return PluginStatusResult.builder()
                .installation(record)
                .plugin(plugin)
                .loaded(record.isInstalled())
                .enabled(record.isInstalled())
                .dependencyStatus(dependencyStatus)
                .latestVersion(latestVersion)
                .updateAvailable(versionComparator.compare(latestVersion, plugin.getVersion()) > 0)
                .build();
    }

    public InstallSubscription subscribe(String installationId) {
        requireId("installationId", installationId);
        if (installations.findById(installationId).isEmpty()) {
            throw new InstallationNotFoundException(installationId);
        }
        return updateRegistry.subscribe(installationId);
    }

    // ==================== 批量操作 ====================

    public BulkInstallResult bulkInstall(String serverId, List<BulkInstallItem> items) {
        requireId("serverId", serverId);
        if (items == null) {
            throw new InvalidArgumentException("items", "Bulk install items cannot be null");
        }
        List<InstallResult> successful = new ArrayList<>();
        List<BulkOperationFailure> failed = new ArrayList<>();
        Duration estimate = Duration.ZERO;

        for (BulkInstallItem item : items) {
            String pluginId = item != null ? item.getPluginId() : null;
            try {
                if (item == null) {
                    throw new InvalidArgumentException("items", "Bulk install item cannot be null");
                }
                InstallResult result = install(InstallRequest.builder()
                        .serverId(serverId)
                        .pluginId(item.getPluginId())
                        .configOverrides(item.getConfigOverrides())
                        .autoDependencies(item.isAutoDependencies())
                        .force(item.isForce())
                        .build());
                successful.add(result);
                estimate = estimate.plus(result.getEstimatedDuration());
            } catch (CraftPlaneException e) {
                log.warn("[{}] Bulk install of {} failed: {}", serverId, pluginId, e.getMessage());
                failed.add(new BulkOperationFailure(pluginId, e.getReasonCode(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("[{}] Bulk install of {} failed unexpectedly", serverId, pluginId, e);
                failed.add(new BulkOperationFailure(pluginId, ReasonCode.EXECUTION_FAILED.code(), e.getMessage()));
            }
        }
        log.info("[{}] Bulk install finished: {} succeeded, {} failed", serverId, successful.size(), failed.size());
        return new BulkInstallResult(items.size(), successful, failed, estimate);
    }

    public BulkUninstallResult bulkUninstall(String serverId, List<String> pluginIds, UninstallOptions options) {
        requireId("serverId", serverId);
        if (pluginIds == null) {
            throw new InvalidArgumentException("pluginIds", "Plugin ids cannot be null");
        }
        List<String> removed = new ArrayList<>();
        List<BulkOperationFailure> failed = new ArrayList<>();

        for (String pluginId : pluginIds) {
            try {
                uninstall(serverId, pluginId, options);
                removed.add(pluginId);
            } catch (CraftPlaneException e) {
                log.warn("[{}] Bulk uninstall of {} failed: {}", serverId, pluginId, e.getMessage());
                failed.add(new BulkOperationFailure(pluginId, e.getReasonCode(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("[{}] Bulk uninstall of {} failed unexpectedly", serverId, pluginId, e);
                failed.add(new BulkOperationFailure(pluginId, ReasonCode.EXECUTION_FAILED.code(), e.getMessage()));
            }
        }
        Duration estimate = config.getUninstallEstimate().multipliedBy(removed.size());
        log.info("[{}] Bulk uninstall finished: {} succeeded, {} failed", serverId, removed.size(), failed.size());
        return new BulkUninstallResult(pluginIds.size(), removed, failed, estimate);
    }

    public void shutdown() {
        log.info("Shutting down installation orchestrator...");
        executor.shutdown();
        updateRegistry.clear();
    }

    // ==================== 内部方法 ====================

    /**
     * 提交异步任务；被拒绝时直接把记录标记为失败
     */
    private boolean submit(String installationId, String serverId, Runnable task) {
        try {
            executor.submit(installationId, task);
            return true;
        } catch (RejectedExecutionException e) {
            fail(installationId, serverId, "Task rejected", e);
            return false;
        }
    }

    private void saveProgress(ServerPluginInstallation record, int progress, String message) {
        record.appendToLog(message);
        installations.update(record);
        updateRegistry.publish(InstallUpdate.of(record.getId(), record.getStatus(), progress, message));
    }

    private void fail(String installationId, String serverId, String message, Exception cause) {
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("[{}] {} for installation {}: {}", serverId, message, installationId, error, cause);

        Optional<ServerPluginInstallation> current = installations.findById(installationId);
        if (current.isEmpty()) {
            log.warn("[{}] Installation {} disappeared before it could be marked failed", serverId, installationId);
        } else if (current.get().getStatus().canTransitionTo(InstallationStatus.FAILED)) {
            ServerPluginInstallation record = current.get();
            record.transitionTo(InstallationStatus.FAILED, error);
            record.appendToLog(message + ": " + error);
            installations.update(record);
        } else {
            log.warn("[{}] Installation {} is {} and cannot be marked failed", serverId, installationId,
                    current.get().getStatus());
        }
        updateRegistry.publish(InstallUpdate.failed(installationId, message, error));
    }

    private ServerPluginInstallation requireInstalled(String serverId, String pluginId) {
        ServerPluginInstallation record = installations.findByServerAndPlugin(serverId, pluginId)
                .orElseThrow(() -> new InstallationNotFoundException(serverId, pluginId));
        if (!record.isInstalled()) {
            throw new InstallationConflictException(ReasonCode.NOT_INSTALLED, serverId, pluginId,
                    String.format("Plugin %s is not installed on server %s (%s)", pluginId, serverId,
                            record.getStatus().code()));
        }
        return record;
    }

    /**
     * 服务器上声明依赖 plugin 的其它活跃插件名
     */
    private List<String> findDependents(String serverId, PluginPackage plugin) {
        List<String> dependents = new ArrayList<>();
        for (ServerPluginInstallation installation : installations.findByServer(serverId)) {
            if (installation.getPluginId().equals(plugin.getId()) || !installation.isActive()
                    || installation.getStatus() == InstallationStatus.REMOVING) {
                continue;
            }
            catalog.findById(installation.getPluginId())
                    .filter(p -> p.dependsOn(plugin.getName()))
                    .ifPresent(p -> dependents.add(p.getName()));
        }
        return dependents;
    }

    private Set<String> activePluginNames(String serverId) {
        Set<String> names = new HashSet<>();
        for (ServerPluginInstallation installation : installations.findByServer(serverId)) {
            if (installation.isActive()) {
                catalog.findById(installation.getPluginId()).ifPresent(p -> names.add(p.getName()));
            }
        }
        return names;
    }

    private ServerPluginInstallation loadRecord(String installationId) {
        return installations.findById(installationId)
                .orElseThrow(() -> new InstallationNotFoundException(installationId));
    }

    private ServerInstance loadServer(String serverId) {
        return servers.findById(serverId).orElseThrow(() -> new ServerNotFoundException(serverId));
    }

    private PluginPackage loadPlugin(String pluginId) {
        return catalog.findById(pluginId).orElseThrow(() -> new PluginNotFoundException(pluginId));
    }

    private ReentrantLock lockFor(String serverId) {
        return serverLocks.computeIfAbsent(serverId, k -> new ReentrantLock());
    }

    int serverLockCount() {
        return serverLocks.size();
    }

    private static boolean requiresRestart(PluginPackage plugin) {
        return plugin.getCategory() != null && plugin.getCategory().requiresRestart();
    }

    private static String requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(field, field + " cannot be blank");
        }
        return value;
    }
}
