package com.craftplane.core.conflict;

/**
 * 规则命中结果：冲突及其处理建议
 */
public record ConflictFinding(PluginConflict conflict, ConflictRecommendation recommendation) {
}
