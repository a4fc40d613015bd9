package com.craftplane.api.exception;

import lombok.Getter;

@Getter
public class ServerNotFoundException extends CraftPlaneException {

    private final String serverId;

    public ServerNotFoundException(String serverId) {
        super(ReasonCode.SERVER_NOT_FOUND, "Server not found: " + serverId);
        this.serverId = serverId;
    }
}
