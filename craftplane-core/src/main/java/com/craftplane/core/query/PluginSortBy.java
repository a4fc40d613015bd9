package com.craftplane.core.query;

import com.craftplane.api.model.PluginPackage;

import java.time.Instant;
import java.util.Comparator;

/**
 * 排序字段，均为升序比较器，降序由 {@link SortOrder} 反转
 */
public enum PluginSortBy {

    NAME(Comparator.comparing(PluginPackage::getName, String.CASE_INSENSITIVE_ORDER)),
    POPULARITY(Comparator.comparingLong(PluginPackage::getDownloadCount)),
    RATING(Comparator.comparingDouble(PluginPackage::getRating)),
    UPDATED(Comparator.comparing(PluginPackage::getUpdatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))),
    CREATED(Comparator.comparing(PluginPackage::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));

    private final Comparator<PluginPackage> comparator;

    PluginSortBy(Comparator<PluginPackage> comparator) {
        this.comparator = comparator;
    }

    public Comparator<PluginPackage> comparator() {
        return comparator;
    }
}
