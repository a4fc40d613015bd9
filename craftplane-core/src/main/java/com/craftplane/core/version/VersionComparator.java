package com.craftplane.core.version;

/**
 * 版本比较策略
 * 替换为语义化版本实现时，其它组件的契约不变
 */
public interface VersionComparator {

    int compare(String left, String right);

    /**
     * 已安装版本是否满足约束
     */
    boolean satisfies(String version, String constraint);

    /**
     * 主版本号是否变化（用于判断破坏性更新）
     */
    boolean isMajorChange(String from, String to);
}
