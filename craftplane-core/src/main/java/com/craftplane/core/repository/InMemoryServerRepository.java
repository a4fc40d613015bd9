package com.craftplane.core.repository;

import com.craftplane.api.model.ServerInstance;
import com.craftplane.core.spi.ServerRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryServerRepository implements ServerRepository {

    private final Map<String, ServerInstance> servers = new ConcurrentHashMap<>();

    public void register(ServerInstance server) {
        servers.put(server.getId(), server);
    }

    @Override
    public Optional<ServerInstance> findById(String serverId) {
        if (serverId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(servers.get(serverId));
    }
}
