package com.craftplane.core.compat;

public enum DependencyIssueType {
    /**
     * 服务器上没有同名插件
     */
    MISSING,
    /**
     * 已有同名插件，但版本不满足约束
     */
    VERSION_MISMATCH
}
