package com.craftplane.core.compat;

import com.craftplane.api.model.PluginPackage;

import java.util.List;

/**
 * 资源冲突规则
 * <p>
 * 新增冲突类型只需新增实现并注册到 {@link CompatibilityValidator}。
 */
public interface ResourceConflictRule {

    /**
     * @param candidate 待安装插件
     * @param present   服务器上已有的其它插件（不含 candidate 自身）
     */
    List<ResourceConflict> check(PluginPackage candidate, List<PluginPackage> present);
}
