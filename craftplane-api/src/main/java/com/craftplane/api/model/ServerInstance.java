package com.craftplane.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * 正在运行的服务器实例（只读视图）
 */
@Value
@Builder
public class ServerInstance {
    String id;
    String name;
    String gameVersion;
}
