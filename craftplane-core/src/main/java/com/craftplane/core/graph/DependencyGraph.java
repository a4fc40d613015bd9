package com.craftplane.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 依赖图（单次请求内有效，非线程安全）
 * <p>
 * 节点保持插入顺序，边方向为 依赖方 -> 被依赖方。
 */
public class DependencyGraph {

    private final Map<String, DependencyNode> nodes = new LinkedHashMap<>();
    private final List<DependencyEdge> edges = new ArrayList<>();

    /**
     * @return 节点已存在时返回 false
     */
    public boolean addNode(DependencyNode node) {
        return nodes.putIfAbsent(node.pluginId(), node) == null;
    }

    public void addEdge(DependencyEdge edge) {
        edges.add(edge);
    }

    public boolean containsNode(String pluginId) {
        return nodes.containsKey(pluginId);
    }

    public DependencyNode getNode(String pluginId) {
        return nodes.get(pluginId);
    }

    public List<DependencyNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    public List<DependencyEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * pluginId 直接依赖的插件
     */
    public List<String> dependenciesOf(String pluginId) {
        return edges.stream().filter(e -> e.from().equals(pluginId)).map(DependencyEdge::to).toList();
    }

    /**
     * 直接依赖 pluginId 的插件
     */
    public List<String> dependentsOf(String pluginId) {
        return edges.stream().filter(e -> e.to().equals(pluginId)).map(DependencyEdge::from).toList();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return "DependencyGraph{nodes=" + nodes.keySet() + ", edges=" + edges.size() + "}";
    }
}
