package com.craftplane.core.install;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class UninstallOptions {

    private final boolean removeConfig;
    private final boolean removeData;

    /**
     * 存在依赖方时仍然卸载
     */
    private final boolean force;

    /**
     * 跳过依赖方检查
     */
    private final boolean skipDependencies;

    public static UninstallOptions defaults() {
        return UninstallOptions.builder().build();
    }
}
