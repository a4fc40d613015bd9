package com.craftplane.core.install;

/**
 * @param applied 配置已保存；为 false 表示推送到运行实例失败（不回滚）
 */
public record ConfigureResult(String installationId, boolean applied, String message) {
}
