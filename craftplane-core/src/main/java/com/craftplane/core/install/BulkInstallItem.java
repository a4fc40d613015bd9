package com.craftplane.core.install;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@Builder
@ToString
public class BulkInstallItem {

    private final String pluginId;

    @Builder.Default
    private final Map<String, Object> configOverrides = Map.of();

    @Builder.Default
    private final boolean autoDependencies = true;

    private final boolean force;

    public static BulkInstallItem of(String pluginId) {
        return BulkInstallItem.builder().pluginId(pluginId).build();
    }
}
