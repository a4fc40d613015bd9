package com.craftplane.api.exception;

import lombok.Getter;

/**
 * 严格依赖模式下，某个依赖无法安装
 */
@Getter
public class DependencyInstallException extends CraftPlaneException {

    private final String dependencyId;

    public DependencyInstallException(String pluginId, String dependencyId, CraftPlaneException cause) {
        super(ReasonCode.DEPENDENCY_INSTALL_FAILED,
                String.format("Dependency %s of plugin %s could not be installed: %s",
                        dependencyId, pluginId, cause.getMessage()), cause);
        this.dependencyId = dependencyId;
    }
}
