package com.craftplane.core.executor;

import com.craftplane.core.config.CraftPlaneConfig;
import com.craftplane.core.spi.InstallationExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 默认安装执行器：有界线程池
 * <p>
 * 队列满时直接拒绝（AbortPolicy），由编排器把对应记录标记为失败，不阻塞调用线程。
 */
@Slf4j
public class ThreadPoolInstallationExecutor implements InstallationExecutor {

    private static final long KEEP_ALIVE_TIME = 60L;

    private final ExecutorService executor;
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public ThreadPoolInstallationExecutor(CraftPlaneConfig config) {
        this(config.getExecutorCorePoolSize(), config.getExecutorMaxPoolSize(), config.getExecutorQueueCapacity());
    }

    public ThreadPoolInstallationExecutor(int corePoolSize, int maxPoolSize, int queueCapacity) {
        this.executor = new ThreadPoolExecutor(
                corePoolSize,
                Math.max(corePoolSize, maxPoolSize),
                KEEP_ALIVE_TIME, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("craftplane-install-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((thread, e) ->
                            log.error("Thread {} failed: {}", thread.getName(), e.getMessage(), e));
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Override
    public void submit(String installationId, Runnable task) {
        executor.execute(task);
        log.debug("Task submitted for installation {}", installationId);
    }

    @Override
    public void shutdown() {
        log.info("Shutting down installation executor...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
