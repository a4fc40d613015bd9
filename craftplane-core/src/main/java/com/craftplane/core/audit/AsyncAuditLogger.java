package com.craftplane.core.audit;

import com.craftplane.core.spi.AuditSink;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 默认审计接收端 (异步非阻塞)
 * <p>
 * 单线程保证日志顺序，队列满时丢弃，不影响安装主流程。
 */
@Slf4j
public class AsyncAuditLogger implements AuditSink {

    private final ExecutorService executor;

    public AsyncAuditLogger() {
        this(1000);
    }

    public AsyncAuditLogger(int queueCapacity) {
        this.executor = new ThreadPoolExecutor(
                1,
                1,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                r -> {
                    Thread thread = new Thread(r, "craftplane-audit-logger");
                    thread.setDaemon(true);
                    thread.setUncaughtExceptionHandler((t, e) ->
                            log.error("Thread {} failed: {}", t.getName(), e.getMessage()));
                    return thread;
                },
                new ThreadPoolExecutor.DiscardPolicy()
        );
    }

    @Override
    public void record(AuditEvent event) {
        try {
            executor.execute(() -> log.info("[AUDIT] Action={}, Server={}, Plugin={}, Details={}, Time={}",
                    event.action(), event.serverId(), event.pluginId(), event.details(), event.timestamp()));
        } catch (RejectedExecutionException e) {
            // 已关闭
            log.debug("Audit event dropped after shutdown: {}", event.action());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down audit executor...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
