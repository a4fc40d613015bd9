package com.craftplane.core.install;

import com.craftplane.api.model.InstallationStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

@Getter
@Builder
@ToString
public class InstallResult {

    private final String installationId;
    private final String pluginId;
    private final InstallationStatus status;
    private final Duration estimatedDuration;

    // 本次一并请求安装的依赖插件 id（按安装顺序）
    @Singular
    private final List<String> dependencies;

    // 请求失败的依赖插件 id（仅尽力而为模式）
    @Singular
    private final List<String> failedDependencies;

    private final boolean requiresRestart;
}
