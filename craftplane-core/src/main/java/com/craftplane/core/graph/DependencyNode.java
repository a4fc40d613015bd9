package com.craftplane.core.graph;

public record DependencyNode(String pluginId, String name, String version, boolean required) {
}
