package com.craftplane.api.exception;

import lombok.Getter;

import java.util.Set;

/**
 * 依赖图存在环，无法给出安装顺序
 */
@Getter
public class CircularDependencyException extends CraftPlaneException {

    // 拓扑排序结束后仍未调度的节点（环及依赖环的节点）
    private final Set<String> unresolved;

    public CircularDependencyException(Set<String> unresolved) {
        super(ReasonCode.CIRCULAR_DEPENDENCY, "Circular dependencies detected among: " + unresolved);
        this.unresolved = Set.copyOf(unresolved);
    }
}
