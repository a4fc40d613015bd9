package com.craftplane.api.exception;

public class InstallationNotFoundException extends CraftPlaneException {

    public InstallationNotFoundException(String installationId) {
        super(ReasonCode.INSTALLATION_NOT_FOUND, "Installation not found: " + installationId);
    }

    public InstallationNotFoundException(String serverId, String pluginId) {
        super(ReasonCode.INSTALLATION_NOT_FOUND,
                String.format("Plugin %s is not installed on server %s", pluginId, serverId));
    }
}
