package com.craftplane.core.conflict;

import com.craftplane.api.model.PluginPackage;

import java.util.List;

/**
 * 插件对冲突规则
 */
public interface ConflictRule {

    /**
     * 检查一对插件，没有冲突时返回空列表
     */
    List<ConflictFinding> detect(PluginPackage first, PluginPackage second);

    /**
     * 对称规则 detect(a, b) 与 detect(b, a) 结果等价，每对只检查一次；
     * 非对称规则两个方向都会检查
     */
    default boolean isSymmetric() {
        return true;
    }
}
