package com.craftplane.core.install.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 安装进度订阅表
 * <p>
 * 发布持读锁、订阅/取消持写锁；发布永不阻塞，慢订阅者只会丢消息，不会拖慢安装任务。
 * 同一安装的消息由同一任务顺序发布，因此每个订阅者按发出顺序收到。
 * <p>
 * 终态消息（进度 100）送达后，该安装 ID 上的订阅全部关闭并移除；订阅者读完缓冲即结束。
 * 同一安装 ID 上的后续操作（例如版本更新）需要重新订阅。
 */
@Slf4j
public class InstallUpdateRegistry {

    private final int bufferSize;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<InstallSubscription>> subscriptions = new HashMap<>();

    public InstallUpdateRegistry(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Subscriber buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    public InstallSubscription subscribe(String installationId) {
        InstallSubscription subscription = new InstallSubscription(installationId, bufferSize, this);
        lock.writeLock().lock();
        try {
            subscriptions.computeIfAbsent(installationId, k -> new ArrayList<>()).add(subscription);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Subscribed to install updates", installationId);
        return subscription;
    }

    public void publish(InstallUpdate update) {
        List<InstallSubscription> finished = new ArrayList<>();
        lock.readLock().lock();
        try {
            List<InstallSubscription> targets = subscriptions.get(update.installationId());
            if (targets == null) {
                return;
            }
            for (InstallSubscription subscription : targets) {
                if (!subscription.offer(update) && !subscription.isClosed()) {
                    log.debug("[{}] Subscriber buffer full, update dropped: {}%",
                            update.installationId(), update.progress());
                }
            }
            if (update.isFinal()) {
                finished.addAll(targets);
            }
        } finally {
            lock.readLock().unlock();
        }
        // 读锁不能升级，移除在释放后进行
        finished.forEach(InstallSubscription::close);
    }

    void remove(InstallSubscription subscription) {
        lock.writeLock().lock();
        try {
            List<InstallSubscription> targets = subscriptions.get(subscription.getInstallationId());
            if (targets == null) {
                return;
            }
            targets.remove(subscription);
            if (targets.isEmpty()) {
                subscriptions.remove(subscription.getInstallationId());
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[{}] Subscription closed", subscription.getInstallationId());
    }

    public int getSubscriberCount(String installationId) {
        lock.readLock().lock();
        try {
            List<InstallSubscription> targets = subscriptions.get(installationId);
            return targets == null ? 0 : targets.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 关闭所有订阅，用于停机
     */
    public void clear() {
        List<InstallSubscription> all = new ArrayList<>();
        lock.readLock().lock();
        try {
            subscriptions.values().forEach(all::addAll);
        } finally {
            lock.readLock().unlock();
        }
        all.forEach(InstallSubscription::close);
    }
}
