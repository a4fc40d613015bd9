package com.craftplane.core.install.stream;

import lombok.Getter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单个订阅者的更新通道
 * <p>
 * 有界缓冲区，发布端只做非阻塞 offer，缓冲区满时丢弃并计数。
 * close 后不再接收新消息，已缓冲的消息仍可读取。
 */
public class InstallSubscription implements AutoCloseable {

    @Getter
    private final String installationId;
    private final BlockingQueue<InstallUpdate> buffer;
    private final InstallUpdateRegistry registry;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    InstallSubscription(String installationId, int bufferSize, InstallUpdateRegistry registry) {
        this.installationId = installationId;
        this.buffer = new ArrayBlockingQueue<>(bufferSize);
        this.registry = registry;
    }

    /**
     * 发布端调用，永不阻塞
     *
     * @return 缓冲区已满或已关闭时返回 false
     */
    boolean offer(InstallUpdate update) {
        if (closed.get()) {
            return false;
        }
        if (!buffer.offer(update)) {
            dropped.incrementAndGet();
            return false;
        }
        return true;
    }

    /**
     * 等待下一条更新，超时返回 null
     */
    public InstallUpdate poll(Duration timeout) throws InterruptedException {
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 取出当前已缓冲的全部更新
     */
    public List<InstallUpdate> drain() {
        List<InstallUpdate> updates = new ArrayList<>();
        buffer.drainTo(updates);
        return updates;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 幂等
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            registry.remove(this);
        }
    }
}
