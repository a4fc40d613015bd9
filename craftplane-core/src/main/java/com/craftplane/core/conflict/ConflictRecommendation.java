package com.craftplane.core.conflict;

/**
 * 冲突处理建议，只做提示，从不自动执行
 *
 * @param targetPluginId 建议作用的插件
 */
public record ConflictRecommendation(RecommendationType type, String description, String targetPluginId,
                                     String action) {
}
