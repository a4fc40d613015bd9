package com.craftplane.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 插件目录条目 (Immutable)
 * <p>
 * 发布后不可修改；新版本是一条新记录，与旧版本共享 name。
 */
@Getter
@Builder(toBuilder = true)
public class PluginPackage {

    public static final int MAX_NAME_LENGTH = 100;

    private final String id;
    private final String name;
    private final String version;
    private final String description;
    private final PluginCategory category;

    // 支持的游戏版本，如 "1.20.1"
    @Singular
    private final Set<String> gameVersions;

    // 依赖名 -> 版本约束，如 {"Vault": ">=1.7.0"}
    @Singular
    private final Map<String, String> dependencies;

    // 声明的命令，用于资源冲突检测
    @Singular
    private final Set<String> commands;

    private final boolean approved;

    // 下载量，作为 popularity 排序依据
    private final long downloadCount;

    // 评分 0-5
    private final double rating;

    private final Instant createdAt;
    private final Instant updatedAt;

    public boolean isCompatibleWith(String gameVersion) {
        return gameVersion != null && gameVersions.contains(gameVersion);
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    public boolean dependsOn(String pluginName) {
        return dependencies.containsKey(pluginName);
    }

    public List<String> getDependencyNames() {
        return List.copyOf(new TreeSet<>(dependencies.keySet()));
    }

    /**
     * 与另一个插件共同声明的命令
     */
    public Set<String> sharedCommands(PluginPackage other) {
        Set<String> shared = new TreeSet<>(commands);
        shared.retainAll(other.getCommands());
        return shared;
    }

    /**
     * name@version 唯一键
     */
    public String getUniqueKey() {
        return name + "@" + version;
    }

    /**
     * 校验目录条目，分类为必填项
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Plugin name cannot be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Plugin name cannot exceed " + MAX_NAME_LENGTH + " characters");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Plugin version cannot be blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("Plugin category is required: " + getUniqueKey());
        }
        if (gameVersions.isEmpty()) {
            throw new IllegalArgumentException("At least one game version is required: " + getUniqueKey());
        }
        dependencies.forEach((depName, constraint) -> {
            if (depName == null || depName.isBlank()) {
                throw new IllegalArgumentException("Dependency name cannot be blank: " + getUniqueKey());
            }
            if (constraint == null || constraint.isBlank()) {
                throw new IllegalArgumentException("Version constraint of " + depName + " cannot be blank");
            }
            if (depName.equals(name)) {
                throw new IllegalArgumentException("Plugin cannot depend on itself: " + name);
            }
        });
    }

    @Override
    public String toString() {
        return String.format("PluginPackage{id='%s', name='%s', version='%s'}", id, name, version);
    }
}
