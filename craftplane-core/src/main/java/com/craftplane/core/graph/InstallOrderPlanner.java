package com.craftplane.core.graph;

import com.craftplane.api.exception.CircularDependencyException;
import com.craftplane.api.exception.InvalidArgumentException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 安装顺序规划 (Kahn 拓扑排序)
 * <p>
 * 节点入度 = 尚未排入的依赖数；就绪节点按图中插入顺序先进先出，
 * 同一张图总得到同一个顺序。存在环时不返回部分结果。
 */
@Slf4j
public class InstallOrderPlanner {

    public List<String> plan(DependencyGraph graph) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (DependencyNode node : graph.getNodes()) {
            inDegree.put(node.pluginId(), 0);
            dependents.put(node.pluginId(), new ArrayList<>());
        }

        for (DependencyEdge edge : graph.getEdges()) {
            if (!inDegree.containsKey(edge.from()) || !inDegree.containsKey(edge.to())) {
                throw new InvalidArgumentException("graph",
                        String.format("Edge %s -> %s references an unknown node", edge.from(), edge.to()));
            }
            inDegree.merge(edge.from(), 1, Integer::sum);
            dependents.get(edge.to()).add(edge.from());
        }

        Deque<String> ready = new ArrayDeque<>();
        for (DependencyNode node : graph.getNodes()) {
            if (inDegree.get(node.pluginId()) == 0) {
                ready.add(node.pluginId());
            }
        }

        List<String> order = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != graph.size()) {
            Set<String> unresolved = new LinkedHashSet<>();
            for (DependencyNode node : graph.getNodes()) {
                if (!order.contains(node.pluginId())) {
                    unresolved.add(node.pluginId());
                }
            }
            log.warn("Circular dependency detected, unresolved nodes: {}", unresolved);
            throw new CircularDependencyException(unresolved);
        }
        return order;
    }
}
