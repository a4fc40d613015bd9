package com.craftplane.core.query;

import com.craftplane.api.model.InstallationStatus;
import com.craftplane.api.model.PluginCategory;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 服务器插件列表过滤条件，字段为 null 表示不过滤
 */
@Getter
@Builder
@ToString
public class PluginFilters {

    private final InstallationStatus status;

    // 已安装即视为启用
    private final Boolean enabled;

    private final PluginCategory category;

    public static PluginFilters none() {
        return PluginFilters.builder().build();
    }
}
