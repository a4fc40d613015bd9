package com.craftplane.core.audit;

import java.time.Instant;
import java.util.Map;

/**
 * 审计事件
 *
 * @param action   动作
 * @param serverId 目标服务器
 * @param pluginId 目标插件
 * @param details  附加信息（版本号、选项等）
 */
public record AuditEvent(AuditAction action, String serverId, String pluginId,
                         Map<String, Object> details, Instant timestamp) {

    public AuditEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AuditEvent of(AuditAction action, String serverId, String pluginId, Map<String, Object> details) {
        return new AuditEvent(action, serverId, pluginId, details, Instant.now());
    }
}
