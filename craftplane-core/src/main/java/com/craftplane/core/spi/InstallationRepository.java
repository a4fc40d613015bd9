package com.craftplane.core.spi;

import com.craftplane.api.model.InstallationStatus;
import com.craftplane.api.model.ServerPluginInstallation;

import java.util.List;
import java.util.Optional;

/**
 * 安装记录仓储
 * <p>
 * 实现必须返回副本，调用方对返回对象的修改只有经过 {@link #update} 才生效。
 */
public interface InstallationRepository {

    void create(ServerPluginInstallation installation);

    void update(ServerPluginInstallation installation);

    void delete(String installationId);

    Optional<ServerPluginInstallation> findById(String installationId);

    Optional<ServerPluginInstallation> findByServerAndPlugin(String serverId, String pluginId);

    /**
     * @param status 为 null 时返回全部
     */
    List<ServerPluginInstallation> findByServer(String serverId, InstallationStatus status);

    default List<ServerPluginInstallation> findByServer(String serverId) {
        return findByServer(serverId, null);
    }
}
