package com.craftplane.core.query;

import com.craftplane.api.model.PluginCategory;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 目录搜索条件，未设置的条件不参与过滤
 */
@Getter
@Builder
@ToString
public class PluginSearchQuery {

    // 名称包含（大小写不敏感）
    private final String text;
    private final PluginCategory category;
    private final String gameVersion;
    private final boolean approvedOnly;

    @Builder.Default
    private final PluginSortBy sortBy = PluginSortBy.POPULARITY;

    @Builder.Default
    private final SortOrder sortOrder = SortOrder.DESC;

    // null 时使用默认页大小
    private final Integer limit;

    private final int offset;

    public static PluginSearchQuery all() {
        return PluginSearchQuery.builder().build();
    }
}
