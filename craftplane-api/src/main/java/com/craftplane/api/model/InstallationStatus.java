package com.craftplane.api.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 安装生命周期状态
 * <pre>
 * pending -> installing -> installed
 * pending -> failed, installing -> failed
 * installed -> installing (更新)
 * installed -> removing -> removed (记录删除)
 * removing -> failed
 * </pre>
 */
public enum InstallationStatus {

    PENDING,
    INSTALLING,
    INSTALLED,
    FAILED,
    REMOVING,
    REMOVED;

    private Set<InstallationStatus> targets() {
        return switch (this) {
            case PENDING -> EnumSet.of(INSTALLING, FAILED);
            case INSTALLING -> EnumSet.of(INSTALLED, FAILED);
            case INSTALLED -> EnumSet.of(INSTALLING, REMOVING);
            case REMOVING -> EnumSet.of(REMOVED, FAILED);
            case FAILED, REMOVED -> EnumSet.noneOf(InstallationStatus.class);
        };
    }

    public boolean canTransitionTo(InstallationStatus target) {
        return targets().contains(target);
    }

    /**
     * 是否占用 (server, plugin) 槽位
     */
    public boolean isActive() {
        return this != FAILED && this != REMOVED;
    }

    public boolean isInProgress() {
        return this == PENDING || this == INSTALLING || this == REMOVING;
    }

    public boolean isTerminal() {
        return this == INSTALLED || this == FAILED || this == REMOVED;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
