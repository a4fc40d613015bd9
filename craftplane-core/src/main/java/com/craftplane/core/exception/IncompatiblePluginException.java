package com.craftplane.core.exception;

import com.craftplane.api.exception.CraftPlaneException;
import com.craftplane.api.exception.ReasonCode;
import com.craftplane.core.compat.CompatibilityResult;
import lombok.Getter;

/**
 * 兼容性校验未通过，reason 与校验结果的 reasonCode 一致
 */
@Getter
public class IncompatiblePluginException extends CraftPlaneException {

    private final String pluginId;
    private final String serverId;
    private final CompatibilityResult result;

    public IncompatiblePluginException(String pluginId, String serverId, CompatibilityResult result) {
        super(result.getReasonCode() != null ? result.getReasonCode() : ReasonCode.INCOMPATIBLE,
                String.format("Plugin %s is not compatible with server %s: %s", pluginId, serverId, result.getReason()));
        this.pluginId = pluginId;
        this.serverId = serverId;
        this.result = result;
    }
}
