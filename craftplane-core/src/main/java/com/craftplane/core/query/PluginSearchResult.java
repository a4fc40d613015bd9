package com.craftplane.core.query;

import com.craftplane.api.model.PluginPackage;

import java.util.List;

/**
 * @param total 过滤后、分页前的条目数
 * @param page  从 1 开始
 */
public record PluginSearchResult(List<PluginPackage> plugins, int total, int page, int pageSize, int totalPages) {

    public PluginSearchResult {
        plugins = List.copyOf(plugins);
    }
}
