package com.craftplane.core.spi;

import java.util.concurrent.RejectedExecutionException;

/**
 * 安装任务执行器
 * <p>
 * 生产环境使用线程池；测试可替换为同步或手动驱动的实现。
 */
public interface InstallationExecutor {

    /**
     * 提交一个安装/卸载/更新任务，立即返回
     *
     * @throws RejectedExecutionException 执行器已满或已关闭
     */
    void submit(String installationId, Runnable task);

    default void shutdown() {
    }
}
