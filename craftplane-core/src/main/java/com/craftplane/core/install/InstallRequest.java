package com.craftplane.core.install;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@Builder(toBuilder = true)
@ToString
public class InstallRequest {

    private final String serverId;
    private final String pluginId;

    @Builder.Default
    private final Map<String, Object> configOverrides = Map.of();

    /**
     * 自动解析并安装传递依赖
     */
    private final boolean autoDependencies;

    /**
     * 忽略兼容性校验结果（不影响重复安装检查）
     */
    private final boolean force;

    public static InstallRequest of(String serverId, String pluginId) {
        return InstallRequest.builder().serverId(serverId).pluginId(pluginId).build();
    }
}
