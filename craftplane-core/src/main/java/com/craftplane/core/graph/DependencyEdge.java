package com.craftplane.core.graph;

/**
 * 依赖边：from 依赖 to
 */
public record DependencyEdge(String from, String to, String versionConstraint, boolean optional) {
}
