package com.craftplane.api.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 服务器与插件的关联记录，跟踪单个插件在单台服务器上的生命周期
 * <p>
 * 非线程安全：仓储层应交出副本，由编排器在单个任务内修改。
 */
@Getter
@Setter
public class ServerPluginInstallation {

    private String id;
    private String serverId;
    private String pluginId;
    private InstallationStatus status;

    // 配置覆盖项，对本子系统不透明
    private Map<String, Object> configOverrides = new HashMap<>();

    private Instant installedAt;
    private String errorMessage;
    private String installationLog;
    private Instant createdAt;
    private Instant updatedAt;

    public ServerPluginInstallation() {
    }

    public ServerPluginInstallation(String id, String serverId, String pluginId, InstallationStatus status) {
        this.id = id;
        this.serverId = serverId;
        this.pluginId = pluginId;
        this.status = status;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * 状态迁移，非法迁移直接抛出
     *
     * @param target       目标状态
     * @param errorMessage 失败原因，仅 FAILED 时需要
     */
    public void transitionTo(InstallationStatus target, String errorMessage) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format("Installation %s cannot transition from %s to %s",
                    id, status, target));
        }
        if (target == InstallationStatus.FAILED && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("Error message is required when installation fails");
        }
        this.status = target;
        this.errorMessage = errorMessage;
        this.updatedAt = Instant.now();
        if (target == InstallationStatus.INSTALLED) {
            this.installedAt = this.updatedAt;
        }
    }

    public void transitionTo(InstallationStatus target) {
        transitionTo(target, null);
    }

    public void appendToLog(String message) {
        installationLog = (installationLog == null || installationLog.isEmpty())
                ? message : installationLog + "\n" + message;
    }

    public boolean isInstalled() {
        return status == InstallationStatus.INSTALLED;
    }

    public boolean isFailed() {
        return status == InstallationStatus.FAILED;
    }

    public boolean isInProgress() {
        return status != null && status.isInProgress();
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    /**
     * 从创建到安装完成的耗时，未完成时为 null
     */
    public Duration getInstallationDuration() {
        if (installedAt == null || createdAt == null) {
            return null;
        }
        return Duration.between(createdAt, installedAt);
    }

    public void setConfigOverrides(Map<String, Object> configOverrides) {
        this.configOverrides = configOverrides != null ? new HashMap<>(configOverrides) : new HashMap<>();
    }

    /**
     * 深拷贝（配置值本身不复制）
     */
    public ServerPluginInstallation copy() {
        ServerPluginInstallation copy = new ServerPluginInstallation();
        copy.id = this.id;
        copy.serverId = this.serverId;
        copy.pluginId = this.pluginId;
        copy.status = this.status;
        copy.configOverrides = new HashMap<>(this.configOverrides);
        copy.installedAt = this.installedAt;
        copy.errorMessage = this.errorMessage;
        copy.installationLog = this.installationLog;
        copy.createdAt = this.createdAt;
        copy.updatedAt = this.updatedAt;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("ServerPluginInstallation{id='%s', server='%s', plugin='%s', status=%s}",
                id, serverId, pluginId, status);
    }
}
