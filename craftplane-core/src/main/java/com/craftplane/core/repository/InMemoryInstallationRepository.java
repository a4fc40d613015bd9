package com.craftplane.core.repository;

import com.craftplane.api.model.InstallationStatus;
import com.craftplane.api.model.ServerPluginInstallation;
import com.craftplane.core.spi.InstallationRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存安装记录仓储，读写均复制对象
 */
public class InMemoryInstallationRepository implements InstallationRepository {

    private final Map<String, ServerPluginInstallation> installations = new ConcurrentHashMap<>();

    @Override
    public void create(ServerPluginInstallation installation) {
        if (installations.putIfAbsent(installation.getId(), installation.copy()) != null) {
            throw new IllegalStateException("Installation already exists: " + installation.getId());
        }
    }

    @Override
    public void update(ServerPluginInstallation installation) {
        if (installations.replace(installation.getId(), installation.copy()) == null) {
            throw new IllegalStateException("Installation does not exist: " + installation.getId());
        }
    }

    @Override
    public void delete(String installationId) {
        installations.remove(installationId);
    }

    @Override
    public Optional<ServerPluginInstallation> findById(String installationId) {
        if (installationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(installations.get(installationId)).map(ServerPluginInstallation::copy);
    }

    @Override
    public Optional<ServerPluginInstallation> findByServerAndPlugin(String serverId, String pluginId) {
        return installations.values().stream()
                .filter(i -> i.getServerId().equals(serverId) && i.getPluginId().equals(pluginId))
                .findFirst()
                .map(ServerPluginInstallation::copy);
    }

    @Override
    public List<ServerPluginInstallation> findByServer(String serverId, InstallationStatus status) {
        List<ServerPluginInstallation> result = new ArrayList<>();
        for (ServerPluginInstallation installation : installations.values()) {
            if (installation.getServerId().equals(serverId)
                    && (status == null || installation.getStatus() == status)) {
                result.add(installation.copy());
            }
        }
        // 按创建时间输出，便于排查
        result.sort((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()));
        return result;
    }
}
