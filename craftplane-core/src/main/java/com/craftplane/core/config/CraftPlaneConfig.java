package com.craftplane.core.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

/**
 * CraftPlane Core 全局配置对象 (Immutable)
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽 Spring Boot 或其他外部环境的差异。
 * 由 Starter 从 {@code craftplane.*} 属性构建，单元测试直接使用 builder。
 */
@Data
@Builder
@ToString
public class CraftPlaneConfig {

    public static CraftPlaneConfig defaults() {
        return CraftPlaneConfig.builder().build();
    }

    // ================= 兼容性策略 =================

    /**
     * 是否允许安装未审核插件
     */
    @Builder.Default
    private boolean allowUnapproved = false;

    /**
     * 依赖安装模式
     * <p>
     * false: 尽力而为，单个依赖失败只记录日志，主插件照常安装
     * <p>
     * true: 全有或全无，任一依赖失败则主插件安装被拒绝
     */
    @Builder.Default
    private boolean strictDependencies = false;

    // ================= 更新流 =================

    /**
     * 每个订阅者的缓冲区大小，满了之后新进度被丢弃
     */
    @Builder.Default
    private int subscriberBufferSize = 10;

    // ================= 执行器 =================

    @Builder.Default
    private int executorCorePoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());

    @Builder.Default
    private int executorMaxPoolSize = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);

    /**
     * 有界队列，防止安装任务无限积压
     */
    @Builder.Default
    private int executorQueueCapacity = 100;

    // ================= 查询 =================

    @Builder.Default
    private int defaultPageSize = 50;

    @Builder.Default
    private int maxPageSize = 100;

    // ================= 配置覆盖项校验 =================

    @Builder.Default
    private int maxConfigEntries = 100;

    @Builder.Default
    private int maxConfigKeyLength = 100;

    // ================= 耗时估算 =================

    @Builder.Default
    private Duration baseInstallEstimate = Duration.ofSeconds(30);

    @Builder.Default
    private Duration perDependencyEstimate = Duration.ofSeconds(15);

    @Builder.Default
    private Duration uninstallEstimate = Duration.ofSeconds(10);
}
