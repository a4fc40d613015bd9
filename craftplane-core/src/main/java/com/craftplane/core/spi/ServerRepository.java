package com.craftplane.core.spi;

import com.craftplane.api.model.ServerInstance;

import java.util.Optional;

public interface ServerRepository {

    Optional<ServerInstance> findById(String serverId);
}
